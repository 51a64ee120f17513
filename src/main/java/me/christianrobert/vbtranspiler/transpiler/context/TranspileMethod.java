package me.christianrobert.vbtranspiler.transpiler.context;

/**
 * Provenance of transpiled code: which path produced it.
 */
public enum TranspileMethod {

    RULE_BASED("rule-based"),
    AI_ASSISTED("ai-assisted");

    private final String tag;

    TranspileMethod(String tag) {
        this.tag = tag;
    }

    /**
     * @return Tag used in API responses
     */
    public String getTag() {
        return tag;
    }
}
