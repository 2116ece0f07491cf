package org.accesstwin.consult.gateway.config;

import org.accesstwin.consult.common.ConsultConstants;

/**
 * Wire dialect spoken by a local inference server.
 */
public enum ServerDialect {

    OLLAMA_CHAT("ollama", ConsultConstants.OLLAMA_DEFAULT_URL, ConsultConstants.OLLAMA_DEFAULT_MODEL),

    OPENAI_COMPATIBLE("lmstudio", ConsultConstants.LMSTUDIO_DEFAULT_URL, ConsultConstants.LMSTUDIO_DEFAULT_MODEL);

    private final String providerId;
    private final String defaultUrl;
    private final String defaultModel;

    ServerDialect(String providerId, String defaultUrl, String defaultModel) {
        this.providerId = providerId;
        this.defaultUrl = defaultUrl;
        this.defaultModel = defaultModel;
    }

    public String getProviderId() {
        return providerId;
    }

    public String getDefaultUrl() {
        return defaultUrl;
    }

    public String getDefaultModel() {
        return defaultModel;
    }
}
