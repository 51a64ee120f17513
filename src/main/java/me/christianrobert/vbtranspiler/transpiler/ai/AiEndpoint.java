package me.christianrobert.vbtranspiler.transpiler.ai;

/**
 * Where the AI rewrite service lives and how to authenticate against it.
 */
public class AiEndpoint {

    private final String serverUrl;
    private final String apiKey;

    public AiEndpoint(String serverUrl, String apiKey) {
        this.serverUrl = serverUrl;
        this.apiKey = apiKey;
    }

    public String getServerUrl() {
        return serverUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public boolean isConfigured() {
        return serverUrl != null && !serverUrl.isBlank();
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String toString() {
        // never log the key itself
        return "AiEndpoint{serverUrl='" + serverUrl + "', apiKey=" + (hasApiKey() ? "set" : "none") + "}";
    }
}
