package com.reviewsearch.indexer.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.reviewsearch.indexer.document.IndexDocument;
import com.reviewsearch.indexer.document.IndexField;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Writes documents to a Solr core through its JSON update API.
 *
 * <p>Field analysis is decided by the core's schema, so the stored/tokenized flags of
 * {@link IndexField} are not sent. Requests are not retried; a failed run is re-run as a
 * whole.</p>
 */
public class SolrSearchBackend implements SearchBackend {

    private static final Logger logger = LoggerFactory.getLogger(SolrSearchBackend.class);

    static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final HttpUrl coreUrl;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public SolrSearchBackend(String coreUrl) {
        this(coreUrl, defaultHttpClient());
    }

    public SolrSearchBackend(String coreUrl, OkHttpClient httpClient) {
        HttpUrl parsed = HttpUrl.parse(coreUrl);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid Solr core URL: " + coreUrl);
        }
        this.coreUrl = parsed;
        this.httpClient = httpClient;
    }

    private static OkHttpClient defaultHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(120, TimeUnit.SECONDS)
                .writeTimeout(60, TimeUnit.SECONDS)
                .build();
    }

    @Override
    public String name() {
        return "solr";
    }

    @Override
    public IndexWriterSession open(boolean truncate) throws SearchBackendException {
        try {
            execute(new Request.Builder().url(endpoint("admin/ping")).get().build());
            SolrWriterSession session = new SolrWriterSession();
            if (truncate) {
                session.deleteByQuery("*:*");
            }
            logger.info("Connected to Solr core {} (truncate: {})", coreUrl, truncate);
            return session;
        } catch (SearchBackendException e) {
            throw e;
        } catch (IOException e) {
            throw new SearchBackendException("Solr core unavailable at " + coreUrl, e);
        }
    }

    // -------------------------------------------------------------------------
    // JSON payloads
    // -------------------------------------------------------------------------

    String addPayload(IndexDocument document) throws JsonProcessingException {
        ArrayNode docs = objectMapper.createArrayNode();
        ObjectNode doc = docs.addObject();
        for (IndexField field : document.fields()) {
            doc.put(field.name(), field.value());
        }
        return objectMapper.writeValueAsString(docs);
    }

    String deletePayload(String query) throws JsonProcessingException {
        ObjectNode root = objectMapper.createObjectNode();
        root.putObject("delete").put("query", query);
        return objectMapper.writeValueAsString(root);
    }

    /**
     * Builds an exact-match query, quoting the value so Solr query syntax in it is inert.
     */
    static String termQuery(String field, String value) {
        return field + ":\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    // -------------------------------------------------------------------------
    // HTTP
    // -------------------------------------------------------------------------

    HttpUrl endpoint(String path) {
        return coreUrl.newBuilder().addPathSegments(path).build();
    }

    private void post(HttpUrl url, String json) throws IOException {
        execute(new Request.Builder()
                .url(url)
                .post(RequestBody.create(json, JSON))
                .build());
    }

    private String execute(Request request) throws IOException {
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String bodyString = body != null ? body.string() : "";
            logger.debug("Solr {} {} -> {}", request.method(), request.url(), response.code());
            if (!response.isSuccessful()) {
                throw new SearchBackendException("Solr error: " + response.code() + " for "
                        + request.url() + ": " + bodyString);
            }
            return bodyString;
        }
    }

    private final class SolrWriterSession implements IndexWriterSession {

        void deleteByQuery(String query) throws IOException {
            post(endpoint("update"), deletePayload(query));
        }

        @Override
        public void deleteDocument(String field, String value) throws IOException {
            deleteByQuery(termQuery(field, value));
        }

        @Override
        public void addDocument(IndexDocument document) throws IOException {
            post(endpoint("update"), addPayload(document));
        }

        @Override
        public void commit() throws IOException {
            post(endpoint("update"), "{\"commit\":{}}");
        }

        @Override
        public void optimize() throws IOException {
            post(endpoint("update").newBuilder().addQueryParameter("optimize", "true").build(), "[]");
        }

        @Override
        public void close() {
            // stateless over HTTP; uncommitted changes are left to Solr's autocommit policy
        }
    }
}
