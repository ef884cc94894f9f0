package ch.so.arp.rag.hybrid.authority;

/**
 * Layer of the pipeline a piece of feedback judges. Authority is tracked per
 * level because expertise in one layer says little about another.
 */
public enum FeedbackLevel {
    RETRIEVAL, REASONING, SYNTHESIS
}
