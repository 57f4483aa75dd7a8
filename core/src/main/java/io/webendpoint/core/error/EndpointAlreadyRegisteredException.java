package io.webendpoint.core.error;

/** Thrown when an endpoint is started while its configuration is still registered. */
public class EndpointAlreadyRegisteredException extends EndpointException {

    private static final long serialVersionUID = 1L;

    public EndpointAlreadyRegisteredException(String endpointId) {
        super("Endpoint already registered: '" + endpointId + "'. Stop it before starting it again.", endpointId);
    }
}
