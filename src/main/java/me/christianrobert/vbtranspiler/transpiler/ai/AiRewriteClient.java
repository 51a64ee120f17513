package me.christianrobert.vbtranspiler.transpiler.ai;

import me.christianrobert.vbtranspiler.core.model.Language;

import java.util.Map;

/**
 * Client of the external AI rewrite service.
 */
public interface AiRewriteClient {

    /**
     * Asks the service to convert source code, sending the exported syntax tree as context.
     *
     * @param endpoint Service location and key
     * @param ast Exported syntax tree, may be null
     * @param sourceCode Code to convert
     * @param source Source language
     * @param target Target language
     * @return Converted code, or a failure describing why the call did not succeed
     */
    AiRewriteResult rewrite(AiEndpoint endpoint, Map<String, Object> ast, String sourceCode, Language source, Language target);

    /**
     * Checks that the service answers. 200 and 201 count as reachable.
     */
    AiConnectionResult testConnection(AiEndpoint endpoint);
}
