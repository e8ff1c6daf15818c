package FacturaBot.nlp;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

/*
Cliente HTTP para el servicio de reconocimiento de entidades (spaCy detrás de una API REST).

SI LA COMUNICACIÓN FALLA, REVISE:
- ¿Está el servicio corriendo en la URL configurada (facturabot.nlp.base-url)?
- ¿Existe el modelo configurado (facturabot.nlp.model) en el servidor?
- ¿Responde POST /ent con {"ents": [...]}?

HTTP client for the entity recognition service (spaCy behind a REST API).

IF COMMUNICATION FAILS, CHECK:
- Is the service running at the configured URL (facturabot.nlp.base-url)?
- Is the configured model (facturabot.nlp.model) installed on the server?
- Does POST /ent answer with {"ents": [...]}?
*/
public class EntityRecognitionClient implements EntityRecognizer {

    private static final Logger log = LoggerFactory.getLogger(EntityRecognitionClient.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    static final Duration DEFAULT_RECHECK = Duration.ofSeconds(60);

    private final String baseUrl;
    private final String modelName;
    private final OkHttpClient client;
    private final Duration recheckInterval;
    private final Clock clock;

    // last reachability answer and when it was taken
    private volatile boolean reachable;
    private volatile Instant checkedAt;

    public EntityRecognitionClient(String baseUrl, String modelName, long timeoutSeconds) {
        this(baseUrl, modelName, timeoutSeconds, DEFAULT_RECHECK, Clock.systemUTC());
    }

    public EntityRecognitionClient(String baseUrl, String modelName, long timeoutSeconds,
                                   Duration recheckInterval, Clock clock) {
        this.recheckInterval = recheckInterval;
        this.clock = clock;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.modelName = modelName;
        this.client = new OkHttpClient.Builder()
                .connectTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .writeTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .callTimeout(timeoutSeconds * 2, TimeUnit.SECONDS)
                .build();

        log.info("EntityRecognitionClient initialised: url={} model={}", this.baseUrl, this.modelName);
    }

    /**
     * Cached result of {@link #isServerReachable()}, refreshed once the recheck interval
     * has passed. A failed call marks the service unreachable until the next check.
     */
    @Override
    public boolean isAvailable() {
        Instant now = clock.instant();
        Instant last = checkedAt;
        if (last == null || !now.isBefore(last.plus(recheckInterval))) {
            reachable = isServerReachable();
            checkedAt = now;
            if (!reachable) {
                log.warn("Entity service at {} not reachable, next check in {}s", baseUrl,
                        recheckInterval.toSeconds());
            }
        }
        return reachable;
    }

    @Override
    public List<RecognizedEntity> recognize(String text) {
        JSONObject requestBody = new JSONObject();
        requestBody.put("text", text == null ? "" : text);
        requestBody.put("model", modelName);

        String endpoint = baseUrl + "/ent";
        Request request = new Request.Builder()
                .url(endpoint)
                .post(RequestBody.create(requestBody.toString(), JSON))
                .addHeader("Content-Type", "application/json")
                .build();

        long startTime = System.currentTimeMillis();
        try (Response response = client.newCall(request).execute()) {
            long duration = System.currentTimeMillis() - startTime;
            String body = response.body() != null ? response.body().string() : "";

            if (!response.isSuccessful()) {
                throw new EntityRecognitionException("Entity service error " + response.code() + ": " + body);
            }

            List<RecognizedEntity> entities = EntityResponseParser.parse(body);
            log.debug("Entity service answered in {}ms with {} entities", duration, entities.size());
            return entities;
        } catch (IOException e) {
            markUnreachable();
            throw new EntityRecognitionException("Connection error to entity service at " + endpoint, e);
        }
    }

    private void markUnreachable() {
        reachable = false;
        checkedAt = clock.instant();
    }

    public boolean isServerReachable() {
        Request request = new Request.Builder()
                .url(baseUrl + "/")
                .get()
                .build();
        try (Response response = client.newCall(request).execute()) {
            return response.isSuccessful();
        } catch (IOException e) {
            log.debug("Entity service not reachable: {}", e.getMessage());
            return false;
        }
    }
}
