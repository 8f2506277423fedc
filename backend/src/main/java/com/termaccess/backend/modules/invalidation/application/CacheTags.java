package com.termaccess.backend.modules.invalidation.application;

public final class CacheTags {

    public static final String NODE_LIST = "node_list";
    public static final String SEARCH_INDEX = "search_index:node_search";

    private CacheTags() {
    }

    public static String node(long contentItemId) {
        return "node:" + contentItemId;
    }

    public static String term(long termId) {
        return "taxonomy_term:" + termId;
    }
}
