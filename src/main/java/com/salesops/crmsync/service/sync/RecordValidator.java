package com.salesops.crmsync.service.sync;

import com.salesops.crmsync.config.CrmSyncProperties;
import com.salesops.crmsync.config.CrmSyncProperties.ValidationRule;
import com.salesops.crmsync.model.dto.CrmRecord;
import com.salesops.crmsync.model.dto.DataQualitySummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Checks local records against the per-module rules in {@code app.sync.validation.rules} and
 * keeps the latest data-quality summary for each module.
 */
@Slf4j
@Component
public class RecordValidator {

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final Pattern PHONE = Pattern.compile("^\\+?[\\d\\s\\-()]{7,}$");
    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ISO_OFFSET_DATE_TIME,
            DateTimeFormatter.ISO_INSTANT);

    private final LocalRecordStore store;
    private final CrmSyncProperties properties;
    private final Clock clock;
    private final Map<String, DataQualitySummary> latest = new ConcurrentHashMap<>();
    private final Map<String, Pattern> compiledPatterns = new ConcurrentHashMap<>();

    public RecordValidator(LocalRecordStore store, CrmSyncProperties properties, Clock clock) {
        this.store = store;
        this.properties = properties;
        this.clock = clock;
    }

    public record FieldError(String field, String message) {}

    public DataQualitySummary validateSample(String module) {
        CrmSyncProperties.Validation validation = properties.getSync().getValidation();
        List<CrmRecord> sample = store.sample(module, validation.getSampleSize());
        List<ValidationRule> rules = validation.getRules().getOrDefault(module, List.of());

        int valid = 0;
        Map<String, Integer> errorsByField = new LinkedHashMap<>();
        for (CrmRecord record : sample) {
            List<FieldError> errors = validate(record, rules);
            if (errors.isEmpty()) {
                valid++;
            } else {
                log.debug("{} record {} failed validation: {}", module, record.id(), errors);
                errors.forEach(e -> errorsByField.merge(e.field(), 1, Integer::sum));
            }
        }
        DataQualitySummary summary = new DataQualitySummary(module, sample.size(), valid, sample.size() - valid,
                errorsByField, clock.instant());
        latest.put(module, summary);
        if (summary.invalid() > 0) {
            log.warn("Data quality for {}: {}/{} records invalid, errors by field {}",
                    module, summary.invalid(), summary.checked(), errorsByField);
        } else {
            log.info("Data quality for {}: all {} sampled records valid", module, summary.checked());
        }
        return summary;
    }

    public List<FieldError> validate(CrmRecord record, List<ValidationRule> rules) {
        List<FieldError> errors = new ArrayList<>();
        for (ValidationRule rule : rules) {
            String field = rule.getField();
            Object value = record.fields().get(field);

            if (value == null || "".equals(value)) {
                if (rule.isRequired()) {
                    errors.add(new FieldError(field, field + " is required"));
                }
                continue;
            }
            if (rule.getType() != null && !matchesType(value, rule.getType())) {
                errors.add(new FieldError(field, field + " must be a valid " + rule.getType()));
                continue;
            }
            if (value instanceof String text) {
                if (rule.getMinLength() != null && text.length() < rule.getMinLength()) {
                    errors.add(new FieldError(field, field + " must be at least " + rule.getMinLength() + " characters"));
                }
                if (rule.getMaxLength() != null && text.length() > rule.getMaxLength()) {
                    errors.add(new FieldError(field, field + " must be at most " + rule.getMaxLength() + " characters"));
                }
                if (rule.getPattern() != null && !pattern(rule.getPattern()).matcher(text).matches()) {
                    errors.add(new FieldError(field, field + " has an invalid format"));
                }
            }
            if (value instanceof Number number) {
                if (rule.getMin() != null && number.doubleValue() < rule.getMin()) {
                    errors.add(new FieldError(field, field + " must be at least " + rule.getMin()));
                }
                if (rule.getMax() != null && number.doubleValue() > rule.getMax()) {
                    errors.add(new FieldError(field, field + " must be at most " + rule.getMax()));
                }
            }
        }
        return errors;
    }

    public Map<String, DataQualitySummary> latestSummaries() {
        return Map.copyOf(latest);
    }

    private boolean matchesType(Object value, String type) {
        return switch (type) {
            case "string" -> value instanceof String;
            case "number" -> value instanceof Number n && !Double.isNaN(n.doubleValue());
            case "boolean" -> value instanceof Boolean;
            case "date" -> value instanceof String s && isDate(s);
            case "email" -> value instanceof String s && EMAIL.matcher(s).matches();
            case "phone" -> value instanceof String s && PHONE.matcher(s).matches();
            default -> true;
        };
    }

    private static boolean isDate(String value) {
        return DATE_FORMATS.stream().anyMatch(format -> parses(format, value));
    }

    private static boolean parses(DateTimeFormatter format, String value) {
        try {
            format.parse(value);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    private Pattern pattern(String regex) {
        return compiledPatterns.computeIfAbsent(regex, Pattern::compile);
    }
}
