// src/main/java/dev/devanks/solaredge/exception/ApiException.java
package dev.devanks.solaredge.exception;

import lombok.Getter;

/**
 * The API answered with a non-2xx status. A 429 means the hourly request quota is used up.
 */
@Getter
public class ApiException extends SolarEdgeException {

    private final int status;
    private final String apiMessage;

    public ApiException(int status, String apiMessage) {
        super(String.format("SolarEdge API rejected the request: HTTP %d - %s", status, apiMessage));
        this.status = status;
        this.apiMessage = apiMessage;
    }

    public boolean isRateLimited() {
        return status == 429;
    }
}
