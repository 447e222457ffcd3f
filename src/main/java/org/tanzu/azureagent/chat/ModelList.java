package org.tanzu.azureagent.chat;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response of GET /v1/models.
 */
public class ModelList {

    private final String object = "list";
    private final List<Model> data;

    public ModelList(List<Model> data) {
        this.data = data;
    }

    public String getObject() { return object; }
    public List<Model> getData() { return data; }

    public static class Model {
        private final String id;
        private final String object = "model";
        private final long created;

        @JsonProperty("owned_by")
        private final String ownedBy;

        public Model(String id, long created, String ownedBy) {
            this.id = id;
            this.created = created;
            this.ownedBy = ownedBy;
        }

        public String getId() { return id; }
        public String getObject() { return object; }
        public long getCreated() { return created; }
        public String getOwnedBy() { return ownedBy; }
    }
}
