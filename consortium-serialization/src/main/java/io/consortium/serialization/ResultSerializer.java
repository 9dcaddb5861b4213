package io.consortium.serialization;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.consortium.core.orchestration.IterationRecord;
import io.consortium.core.orchestration.OrchestrationResult;

/// Renders orchestration results and iteration records as JSON.
///
/// Keys are snake_case (`run_id`, `self_confidence`, `refinement_areas`), timestamps
/// are ISO-8601 strings and absent values are omitted.
///
/// ### Usage
/// {@snippet :
/// OrchestrationResult result = orchestrator.orchestrate(query, config);
/// System.out.println(ResultSerializer.toJson(result));
/// }
///
/// @implNote Thread-safe. `toJson` and `toJsonLine` share one cached mapper.
///
/// @see ConsortiumJacksonModule for the registered mixins
public final class ResultSerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private ResultSerializer() {}

    /// Serializes a result to pretty-printed JSON.
    ///
    /// @param result the completed or failed result, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(OrchestrationResult result) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize result of run " + result.runId() + ": " + e.getMessage(),
                    e);
        }
    }

    /// Serializes one round to a single line of JSON.
    ///
    /// @param record the round to serialize, not null
    /// @return compact JSON without line breaks, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJsonLine(IterationRecord record) {
        try {
            return MAPPER.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize round "
                            + record.roundNumber()
                            + " of run "
                            + record.runId()
                            + ": "
                            + e.getMessage(),
                    e);
        }
    }

    /// Creates an ObjectMapper configured for consortium results.
    ///
    /// Registers:
    /// - `ConsortiumJacksonModule` for result discriminators and failure mixins
    /// - `JavaTimeModule` for `Instant` fields, written as ISO-8601 strings
    /// - snake_case property naming
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for readers of older log files
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new ConsortiumJacksonModule())
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
}
