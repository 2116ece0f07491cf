package org.accesstwin.consult.gateway;

/**
 * Lifecycle of a {@link ConsultationGateway}. Generation does not change the state.
 */
public enum GatewayState {
    UNCONFIGURED,
    CONFIGURED
}
