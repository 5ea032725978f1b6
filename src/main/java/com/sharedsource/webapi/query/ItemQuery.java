package com.sharedsource.webapi.query;

import okhttp3.HttpUrl;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Item web API query.
 *
 * <p>Addresses items by path or id under {@code /-/item/v1} and optionally narrows the result
 * <br>by database, language, version, scope and fields.
 *
 * <p>Example usage:
 * <pre>
 * ItemQuery query = new ItemQuery.Builder()
 *     .withPath("/sitecore/content/Home")
 *     .withDatabase("master")
 *     .withScope(ItemQuery.Scope.SELF, ItemQuery.Scope.CHILDREN)
 *     .build();
 *
 * ItemResponse response = context.getResponse(query, ItemResponse::new);
 * </pre>
 */
public class ItemQuery implements UpdatableQuery {

    /**
     * Result scope relative to the addressed item.
     */
    public enum Scope {
        SELF("s"),
        PARENT("p"),
        CHILDREN("c");

        private final String code;

        Scope(String code) {
            this.code = code;
        }

        public String getCode() {
            return code;
        }
    }

    private final QueryType queryType;
    private final ResponseFormat responseFormat;
    private final String path;
    private final String itemId;
    private final String database;
    private final String language;
    private final Integer version;
    private final List<Scope> scope;
    private final String query;
    private final List<String> fields;
    private final String payload;
    private final Integer page;
    private final Integer pageSize;
    private final String name;
    private final String template;
    private final FieldMap fieldsToUpdate;

    /**
     * Constructs a new ItemQuery instance.
     *
     * @param builder Builder instance.
     */
    private ItemQuery(Builder builder) {
        this.queryType = builder.queryType;
        this.responseFormat = builder.responseFormat;
        this.path = builder.path;
        this.itemId = builder.itemId;
        this.database = builder.database;
        this.language = builder.language;
        this.version = builder.version;
        this.scope = builder.scope;
        this.query = builder.query;
        this.fields = builder.fields;
        this.payload = builder.payload;
        this.page = builder.page;
        this.pageSize = builder.pageSize;
        this.name = builder.name;
        this.template = builder.template;
        this.fieldsToUpdate = builder.fieldsToUpdate;
    }

    @Override
    public QueryType getQueryType() {
        return queryType;
    }

    @Override
    public ResponseFormat getResponseFormat() {
        return responseFormat;
    }

    @Override
    public FieldMap getFieldsToUpdate() {
        return fieldsToUpdate;
    }

    public String getPath() {
        return path;
    }

    public String getItemId() {
        return itemId;
    }

    @Override
    public HttpUrl buildUri(String hostName) {
        HttpUrl.Builder url = HttpUrl.get(hostName).newBuilder()
                .addPathSegments(API_PATH);

        String segments = StringUtils.strip(path, "/");
        if (StringUtils.isNotEmpty(segments)) {
            url.addPathSegments(segments);
        }

        addParameter(url, "sc_itemid", itemId);
        addParameter(url, "sc_database", database);
        addParameter(url, "language", language);
        addParameter(url, "sc_itemversion", version);
        if (!scope.isEmpty()) {
            url.addQueryParameter("scope", String.join("|", scope.stream().map(Scope::getCode).toList()));
        }
        addParameter(url, "query", query);
        if (!fields.isEmpty()) {
            url.addQueryParameter("fields", String.join("|", fields));
        }
        addParameter(url, "payload", payload);
        addParameter(url, "page", page);
        addParameter(url, "pageSize", pageSize);

        if (queryType == QueryType.CREATE) {
            addParameter(url, "name", name);
            addParameter(url, "template", template);
        }

        return url.build();
    }

    private static void addParameter(HttpUrl.Builder url, String name, Object value) {
        if (value != null && StringUtils.isNotEmpty(value.toString())) {
            url.addQueryParameter(name, value.toString());
        }
    }

    @Override
    public String toString() {
        return "ItemQuery{type=" + queryType + ", path='" + path + "', itemId='" + itemId + "'}";
    }

    /**
     * Builder for ItemQuery.
     */
    public static class Builder {
        private QueryType queryType = QueryType.READ;
        private ResponseFormat responseFormat = ResponseFormat.JSON;
        private String path;
        private String itemId;
        private String database;
        private String language;
        private Integer version;
        private final List<Scope> scope = new ArrayList<>();
        private String query;
        private final List<String> fields = new ArrayList<>();
        private String payload;
        private Integer page;
        private Integer pageSize;
        private String name;
        private String template;
        private final FieldMap fieldsToUpdate = new FieldMap();

        /**
         * Sets query type.
         *
         * @param queryType Query type.
         * @return Builder instance.
         */
        public Builder withType(QueryType queryType) {
            this.queryType = queryType;
            return this;
        }

        /**
         * Sets response format.
         *
         * @param responseFormat Response format.
         * @return Builder instance.
         */
        public Builder withResponseFormat(ResponseFormat responseFormat) {
            this.responseFormat = responseFormat;
            return this;
        }

        /**
         * Sets item path.
         *
         * @param path Item path (e.g., "/sitecore/content/Home").
         * @return Builder instance.
         */
        public Builder withPath(String path) {
            this.path = path;
            return this;
        }

        /**
         * Sets item id.
         *
         * @param itemId Item id (e.g., "{110D559F-DEA5-42EA-9C1C-8A5DF7E70EF9}").
         * @return Builder instance.
         */
        public Builder withItemId(String itemId) {
            this.itemId = itemId;
            return this;
        }

        /**
         * Sets database name.
         *
         * @param database Database name (e.g., "master").
         * @return Builder instance.
         */
        public Builder withDatabase(String database) {
            this.database = database;
            return this;
        }

        /**
         * Sets item language.
         *
         * @param language Language code (e.g., "en").
         * @return Builder instance.
         */
        public Builder withLanguage(String language) {
            this.language = language;
            return this;
        }

        /**
         * Sets item version.
         *
         * @param version Version number.
         * @return Builder instance.
         */
        public Builder withVersion(int version) {
            this.version = version;
            return this;
        }

        /**
         * Sets result scope.
         *
         * @param scope Scopes to include.
         * @return Builder instance.
         */
        public Builder withScope(Scope... scope) {
            this.scope.addAll(Arrays.asList(scope));
            return this;
        }

        /**
         * Sets a content query instead of a path.
         *
         * @param query Query (e.g., "/sitecore/content/Home/*").
         * @return Builder instance.
         */
        public Builder withQuery(String query) {
            this.query = query;
            return this;
        }

        /**
         * Restricts returned fields.
         *
         * @param fields Field names or ids.
         * @return Builder instance.
         */
        public Builder withFields(String... fields) {
            this.fields.addAll(Arrays.asList(fields));
            return this;
        }

        /**
         * Sets field payload size.
         *
         * @param payload One of "min", "content" or "full".
         * @return Builder instance.
         */
        public Builder withPayload(String payload) {
            this.payload = payload;
            return this;
        }

        /**
         * Sets result paging.
         *
         * @param page     Zero based page index.
         * @param pageSize Items per page.
         * @return Builder instance.
         */
        public Builder withPage(int page, int pageSize) {
            this.page = page;
            this.pageSize = pageSize;
            return this;
        }

        /**
         * Sets name of the item to create.
         *
         * @param name Item name.
         * @return Builder instance.
         */
        public Builder withName(String name) {
            this.name = name;
            return this;
        }

        /**
         * Sets template of the item to create.
         *
         * @param template Template path relative to the templates root (e.g., "Sample/Sample Item").
         * @return Builder instance.
         */
        public Builder withTemplate(String template) {
            this.template = template;
            return this;
        }

        /**
         * Adds a field value to write.
         *
         * @param fieldName Field name or id.
         * @param value     Field value.
         * @return Builder instance.
         */
        public Builder withField(String fieldName, String value) {
            this.fieldsToUpdate.put(fieldName, value);
            return this;
        }

        /**
         * Adds field values to write.
         *
         * @param values Map of field name to value.
         * @return Builder instance.
         */
        public Builder withFields(Map<String, String> values) {
            this.fieldsToUpdate.putAll(values);
            return this;
        }

        /**
         * Builds the ItemQuery instance.
         *
         * @return ItemQuery instance.
         * @throws IllegalStateException if required fields are missing.
         */
        public ItemQuery build() {
            if (StringUtils.isBlank(path) && StringUtils.isBlank(itemId) && StringUtils.isBlank(query)) {
                throw new IllegalStateException("path, itemId or query must be set");
            }
            if (queryType == QueryType.CREATE && (StringUtils.isBlank(name) || StringUtils.isBlank(template))) {
                throw new IllegalStateException("name and template must be set for create queries");
            }
            return new ItemQuery(this);
        }
    }
}
