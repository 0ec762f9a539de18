package com.crave.search.collection;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-term outcome of a keyword cycle, keyed by the normalized term that was searched.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CollectionCycleResult {
    @JsonProperty("search_results")
    private Map<String, TermSearch> searchResults = new LinkedHashMap<>();

    @JsonProperty("processing_results")
    private Map<String, TermProcessing> processingResults = new LinkedHashMap<>();

    public Map<String, TermSearch> getSearchResults() {
        return searchResults;
    }

    public void setSearchResults(Map<String, TermSearch> searchResults) {
        this.searchResults = searchResults == null ? new LinkedHashMap<>() : searchResults;
    }

    public Map<String, TermProcessing> getProcessingResults() {
        return processingResults;
    }

    public void setProcessingResults(Map<String, TermProcessing> processingResults) {
        this.processingResults = processingResults == null ? new LinkedHashMap<>() : processingResults;
    }

    /**
     * A term counts as collected when content was found for it, or when processing created
     * connections and reported success.
     */
    public boolean succeededFor(String term) {
        TermSearch search = searchResults.get(term);
        if (search != null && (search.getPosts() > 0 || search.getComments() > 0)) {
            return true;
        }
        TermProcessing processing = processingResults.get(term);
        return processing != null && processing.isSuccess() && processing.getConnectionsCreated() > 0;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TermSearch {
        @JsonProperty("posts")
        private int posts;

        @JsonProperty("comments")
        private int comments;

        public TermSearch() {
        }

        public TermSearch(int posts, int comments) {
            this.posts = posts;
            this.comments = comments;
        }

        public int getPosts() {
            return posts;
        }

        public void setPosts(int posts) {
            this.posts = posts;
        }

        public int getComments() {
            return comments;
        }

        public void setComments(int comments) {
            this.comments = comments;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TermProcessing {
        @JsonProperty("success")
        private boolean success;

        @JsonProperty("connections_created")
        private int connectionsCreated;

        public TermProcessing() {
        }

        public TermProcessing(boolean success, int connectionsCreated) {
            this.success = success;
            this.connectionsCreated = connectionsCreated;
        }

        public boolean isSuccess() {
            return success;
        }

        public void setSuccess(boolean success) {
            this.success = success;
        }

        public int getConnectionsCreated() {
            return connectionsCreated;
        }

        public void setConnectionsCreated(int connectionsCreated) {
            this.connectionsCreated = connectionsCreated;
        }
    }
}
