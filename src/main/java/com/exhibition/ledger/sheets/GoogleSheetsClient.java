package com.exhibition.ledger.sheets;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * {@link SheetClient} over the Google Sheets v4 REST values API.
 *
 * <p>Authentication is out of scope: the caller supplies an OAuth access token, which is
 * fetched again for every request so a refreshing supplier works unchanged.</p>
 *
 * <pre>
 * SheetClient client = GoogleSheetsClient.builder()
 *     .accessToken(() -&gt; tokenStore.current())
 *     .timeout(Duration.ofSeconds(30))
 *     .build();
 * </pre>
 */
public class GoogleSheetsClient implements SheetClient {
    private static final Logger log = LoggerFactory.getLogger(GoogleSheetsClient.class);

    private static final String DEFAULT_BASE_URL = "https://sheets.googleapis.com";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final String baseUrl;
    private final Supplier<String> accessToken;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private GoogleSheetsClient(Builder builder) {
        String url = builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL;
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.accessToken = builder.accessToken != null ? builder.accessToken : () -> "";
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public List<String> readHeader(SyncTarget target) {
        JsonNode values = get(target, target.qualify("1:1"), "readHeader").path("values");
        List<String> header = new ArrayList<>();
        if (values.isArray() && !values.isEmpty()) {
            for (JsonNode cell : values.get(0)) {
                header.add(cell.asText(""));
            }
        }
        while (!header.isEmpty() && header.get(header.size() - 1).isBlank()) {
            header.remove(header.size() - 1);
        }
        return header;
    }

    @Override
    public int readRowCount(SyncTarget target) {
        JsonNode values = get(target, target.qualify("A:A"), "readRowCount").path("values");
        return values.isArray() ? values.size() : 0;
    }

    @Override
    public void writeHeader(SyncTarget target, List<String> header) {
        writeRange(target, CellRange.headerRow(header.size()), List.of(header));
    }

    @Override
    public void writeRange(SyncTarget target, CellRange range, List<List<String>> values) {
        String a1 = target.qualify(range.toA1());
        ObjectNode body = objectMapper.createObjectNode();
        body.put("range", a1);
        body.put("majorDimension", "ROWS");
        body.set("values", toArray(values));
        send(HttpRequest.newBuilder(valuesUri(target, a1, "", "valueInputOption=RAW"))
                .PUT(HttpRequest.BodyPublishers.ofString(body.toString())), "writeRange");
    }

    @Override
    public void appendRows(SyncTarget target, List<List<String>> rows) {
        String a1 = target.qualify("A1");
        ObjectNode body = objectMapper.createObjectNode();
        body.put("majorDimension", "ROWS");
        body.set("values", toArray(rows));
        send(HttpRequest.newBuilder(valuesUri(target, a1, ":append",
                        "valueInputOption=RAW&insertDataOption=INSERT_ROWS"))
                .POST(HttpRequest.BodyPublishers.ofString(body.toString())), "appendRows");
    }

    private JsonNode get(SyncTarget target, String a1, String operation) {
        return send(HttpRequest.newBuilder(valuesUri(target, a1, "", null)).GET(), operation);
    }

    private JsonNode send(HttpRequest.Builder request, String operation) {
        HttpRequest built = request
                .timeout(timeout)
                .header("Authorization", "Bearer " + accessToken.get())
                .header("Content-Type", "application/json")
                .build();
        log.debug("sheets.request operation={} method={} uri={}", operation, built.method(), built.uri());

        HttpResponse<String> response;
        try {
            response = httpClient.send(built, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new SheetServiceException(SyncErrorKind.REMOTE_UNKNOWN_ERROR,
                    "Sheets API " + operation + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SheetServiceException(SyncErrorKind.REMOTE_UNKNOWN_ERROR,
                    "Sheets API " + operation + " interrupted", e);
        }

        int status = response.statusCode();
        String body = response.body() != null ? response.body() : "";
        if (status / 100 != 2) {
            SyncErrorKind kind = RemoteErrorClassifier.classify(status, body);
            String message = "Sheets API " + operation + " failed with status " + status + ": " + errorMessage(body);
            log.warn("sheets.error operation={} status={} kind={}", operation, status, kind);
            throw new SheetServiceException(kind, status, message);
        }
        try {
            return body.isBlank() ? objectMapper.createObjectNode() : objectMapper.readTree(body);
        } catch (IOException e) {
            throw new SheetServiceException(SyncErrorKind.REMOTE_UNKNOWN_ERROR,
                    "Sheets API " + operation + " returned malformed JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Extracts {@code error.message} from a Google error body, or returns the body verbatim.
     */
    private String errorMessage(String body) {
        try {
            JsonNode message = objectMapper.readTree(body).path("error").path("message");
            return message.isTextual() ? message.asText() : body;
        } catch (IOException e) {
            return body;
        }
    }

    private URI valuesUri(SyncTarget target, String a1, String suffix, String query) {
        String path = baseUrl + "/v4/spreadsheets/" + encode(target.spreadsheetId())
                + "/values/" + encode(a1) + suffix;
        return URI.create(query != null ? path + "?" + query : path);
    }

    private ArrayNode toArray(List<List<String>> rows) {
        ArrayNode array = objectMapper.createArrayNode();
        for (List<String> row : rows) {
            ArrayNode cells = array.addArray();
            row.forEach(cells::add);
        }
        return array;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl;
        private Supplier<String> accessToken;
        private Duration timeout;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder accessToken(Supplier<String> accessToken) {
            this.accessToken = accessToken;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public GoogleSheetsClient build() {
            return new GoogleSheetsClient(this);
        }
    }
}
