package com.phillippitts.streamasr.exception;

/**
 * Thrown when the recognition service answers with a non-success status code
 * or with an error frame. Carries the service's code and message verbatim.
 */
public class RemoteServiceException extends StreamAsrException {

    private final long code;
    private final String serviceMessage;

    public RemoteServiceException(long code, String serviceMessage) {
        super("Recognition service returned code " + code
                + (serviceMessage == null || serviceMessage.isBlank() ? "" : ": " + serviceMessage));
        this.code = code;
        this.serviceMessage = serviceMessage;
    }

    public long getCode() {
        return code;
    }

    public String getServiceMessage() {
        return serviceMessage;
    }

    @Override
    public String kind() {
        return "remote";
    }
}
