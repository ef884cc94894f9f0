package ch.so.arp.rag.hybrid.parameter;

/**
 * Naming scheme of the keys held in the {@link ParameterStore}.
 */
public final class ParameterKeys {

    public static final String GATING = "gating";
    public static final String RERANK = "rerank";

    private static final String TRAVERSE_PREFIX = "traverse/";
    private static final String ALPHA_PREFIX = "alpha/";

    private ParameterKeys() {
    }

    public static String traverse(String strategyId, String relationType) {
        return TRAVERSE_PREFIX + strategyId + "/" + relationType;
    }

    public static String alpha(String strategyId) {
        return ALPHA_PREFIX + strategyId;
    }

    public static boolean isTraverse(String key) {
        return key.startsWith(TRAVERSE_PREFIX);
    }
}
