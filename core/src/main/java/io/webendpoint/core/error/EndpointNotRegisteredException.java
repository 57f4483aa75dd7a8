package io.webendpoint.core.error;

/** Thrown when an operation needs the registered configuration of an endpoint that is not running. */
public class EndpointNotRegisteredException extends EndpointException {

    private static final long serialVersionUID = 1L;

    public EndpointNotRegisteredException(String endpointId) {
        super("No configuration registered for endpoint '" + endpointId + "'", endpointId);
    }
}
