package io.dispatch4j.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.dispatch4j.PayloadValidationException;
import io.dispatch4j.core.JobType;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Type-checks raw job payloads against the schema of their {@link JobType}.
 *
 * <p>Validation runs in two stages and reports every problem it finds:
 * <ol>
 *     <li>each property Jackson finds on the schema record is converted on its own;
 *     a value that cannot be converted becomes an issue and the property is left null</li>
 *     <li>the record built by Jackson from the remaining values goes through Bean
 *     Validation; violations on fields that already failed conversion are not
 *     reported twice</li>
 * </ol>
 * Unknown keys are dropped. The validator has no side effects and is thread-safe.
 */
public class PayloadValidator {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final Validator validator;
    private final Map<JobType, Class<? extends JobPayload>> schemas;

    public PayloadValidator(ObjectMapper objectMapper) {
        this(objectMapper, PayloadSchemas.defaults());
    }

    public PayloadValidator(ObjectMapper objectMapper, Map<JobType, Class<? extends JobPayload>> schemas) {
        Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        Objects.requireNonNull(schemas, "schemas must not be null");
        for (JobType type : JobType.values()) {
            if (!schemas.containsKey(type)) {
                throw new IllegalStateException("No payload schema registered for job type: " + type);
            }
        }
        this.schemas = new EnumMap<>(schemas);
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
        ValidatorFactory factory = Validation.byDefaultProvider()
                .configure()
                .messageInterpolator(new ParameterMessageInterpolator())
                .buildValidatorFactory();
        this.validator = factory.getValidator();
    }

    public Class<? extends JobPayload> schemaFor(JobType type) {
        return schemas.get(type);
    }

    /**
     * @return the typed payload
     * @throws PayloadValidationException listing every offending field
     */
    public JobPayload validate(JobType type, Object raw) {
        Objects.requireNonNull(type, "type must not be null");
        Class<? extends JobPayload> schema = schemas.get(type);

        if (schema.isInstance(raw)) {
            List<FieldIssue> issues = constraintIssues(schema.cast(raw), Set.of());
            if (!issues.isEmpty()) {
                throw new PayloadValidationException(type, issues);
            }
            return schema.cast(raw);
        }

        Map<String, Object> fields = asMap(type, raw);
        Map<String, Object> convertible = new LinkedHashMap<>();
        List<FieldIssue> issues = new ArrayList<>();
        Set<String> unconvertible = new HashSet<>();

        for (BeanPropertyDefinition property : properties(schema)) {
            String name = property.getName();
            Object value = fields.get(name);
            if (value == null) {
                continue;
            }
            JavaType target = property.getPrimaryType();
            try {
                objectMapper.convertValue(value, target);
                convertible.put(name, value);
            } catch (IllegalArgumentException e) {
                issues.add(new FieldIssue(name, "invalid value, expected " + describe(target)));
                unconvertible.add(name);
                unconvertible.add(property.getInternalName());
            }
        }

        JobPayload payload = build(schema, convertible);
        issues.addAll(constraintIssues(payload, unconvertible));
        if (!issues.isEmpty()) {
            throw new PayloadValidationException(type, issues);
        }
        return payload;
    }

    /**
     * Validates and returns the payload as a map without null values; this is the form
     * stored with the job.
     */
    public Map<String, Object> normalize(JobType type, Object raw) {
        return toMap(validate(type, raw));
    }

    public Map<String, Object> toMap(JobPayload payload) {
        return objectMapper.convertValue(payload, MAP_TYPE);
    }

    private Map<String, Object> asMap(JobType type, Object raw) {
        if (raw == null) {
            return Map.of();
        }
        try {
            return objectMapper.convertValue(raw, MAP_TYPE);
        } catch (IllegalArgumentException e) {
            throw new PayloadValidationException(type, List.of(new FieldIssue("", "payload must be an object")));
        }
    }

    private List<FieldIssue> constraintIssues(JobPayload payload, Set<String> skip) {
        Set<FieldIssue> issues = new LinkedHashSet<>();
        for (ConstraintViolation<JobPayload> violation : validator.validate(payload)) {
            String path = violation.getPropertyPath().toString();
            if (!skip.contains(path)) {
                issues.add(new FieldIssue(path, violation.getMessage()));
            }
        }
        List<FieldIssue> sorted = new ArrayList<>(issues);
        sorted.sort(Comparator.comparing(FieldIssue::path).thenComparing(FieldIssue::message));
        return sorted;
    }

    private List<BeanPropertyDefinition> properties(Class<? extends JobPayload> schema) {
        JavaType schemaType = objectMapper.constructType(schema);
        BeanDescription description = objectMapper.getDeserializationConfig().introspect(schemaType);
        return description.findProperties();
    }

    private JobPayload build(Class<? extends JobPayload> schema, Map<String, Object> convertible) {
        try {
            return objectMapper.convertValue(convertible, schema);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Payload schema " + schema.getSimpleName() + " rejected its arguments", e);
        }
    }

    private String describe(JavaType target) {
        if (target.isEnumType()) {
            List<Object> values = new ArrayList<>();
            for (Object constant : target.getRawClass().getEnumConstants()) {
                values.add(objectMapper.convertValue(constant, Object.class));
            }
            return "one of " + values;
        }
        if (target.isCollectionLikeType()) {
            return "a list";
        }
        return target.getRawClass().getSimpleName();
    }
}
