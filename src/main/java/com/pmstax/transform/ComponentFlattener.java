package com.pmstax.transform;

import com.pmstax.calculator.IndianNumberFormat;
import com.pmstax.domain.enums.ComponentKind;
import com.pmstax.domain.model.FlatForm;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Converts between the nested record the persistence API stores and the flat form
 * edited on screen, driven by {@link ComponentSchemas}.
 *
 * <p>Flattening never throws. A record of the wrong shape (root or sub-record not an
 * object, a number or flag leaf of the wrong type) yields the default form with
 * {@code dataFound=false}. Missing sub-records and null leaves simply take defaults.
 *
 * <p>Unflattening writes every plain field to its primary path, writes each 80G
 * bucket total to its manual constituent (zero to the others), and skips derived fields.
 */
@Component
public class ComponentFlattener {

    private static final Logger log = LoggerFactory.getLogger(ComponentFlattener.class);

    public FlattenResult flatten(ComponentKind kind, Object nested) {
        ComponentSchema schema = ComponentSchemas.forKind(kind);
        if (!(nested instanceof Map<?, ?> root) || root.isEmpty()) {
            if (nested != null && !(nested instanceof Map<?, ?>)) {
                log.warn("Ignoring {} record with non-object root: {}", kind, nested.getClass().getSimpleName());
            }
            return noData(schema);
        }
        try {
            FlatForm form = new FlatForm();
            for (FieldSpec field : schema.getFields()) {
                if (field.isDerived()) {
                    form.put(field.getName(), field.getDefaultValue());
                    continue;
                }
                form.put(field.getName(), field.isAggregate() ? sumConstituents(root, field) : readField(root, field));
            }
            return FlattenResult.builder()
                    .form(recomputeDerived(kind, form))
                    .dataFound(true)
                    .build();
        } catch (MalformedPayloadException e) {
            log.warn("Malformed {} record, falling back to defaults: {}", kind, e.getMessage());
            return noData(schema);
        }
    }

    public Map<String, Object> unflatten(ComponentKind kind, FlatForm form) {
        ComponentSchema schema = ComponentSchemas.forKind(kind);
        Map<String, Object> nested = new LinkedHashMap<>();
        for (FieldSpec field : schema.getFields()) {
            if (field.isReadOnly()) {
                continue;
            }
            Object value = form.contains(field.getName()) ? form.get(field.getName()) : field.getDefaultValue();
            if (field.isAggregate()) {
                // the whole total lands on the write-back leaf; every other constituent is zero
                for (List<String> constituent : field.getConstituents()) {
                    if (!constituent.equals(field.getWriteBackPath())) {
                        write(nested, constituent, BigDecimal.ZERO);
                    }
                }
                write(nested, field.getWriteBackPath(), value);
            } else {
                write(nested, field.getPath(), value);
            }
        }
        return nested;
    }

    /** Defaults for every field of the kind. */
    public FlatForm defaults(ComponentKind kind) {
        return ComponentSchemas.forKind(kind).defaults();
    }

    /**
     * Refreshes derived fields from their source fields in place and returns the form.
     * Called after any edit so read-only totals stay current.
     */
    public FlatForm recomputeDerived(ComponentKind kind, FlatForm form) {
        for (FieldSpec field : ComponentSchemas.forKind(kind).getFields()) {
            if (field.isDerived()) {
                BigDecimal sum = BigDecimal.ZERO;
                for (String source : field.getSourceFields()) {
                    sum = sum.add(form.getNumber(source));
                }
                form.put(field.getName(), sum);
            }
        }
        return form;
    }

    private FlattenResult noData(ComponentSchema schema) {
        return FlattenResult.builder()
                .form(schema.defaults())
                .dataFound(false)
                .notice(FlattenResult.NO_DATA_NOTICE)
                .build();
    }

    private Object readField(Map<?, ?> root, FieldSpec field) {
        Optional<Object> raw = read(root, field.getPath());
        for (List<String> fallback : field.getFallbackPaths()) {
            if (raw.isPresent()) {
                break;
            }
            raw = read(root, fallback);
        }
        if (raw.isEmpty()) {
            return field.getDefaultValue();
        }
        return coerce(field, raw.get());
    }

    private BigDecimal sumConstituents(Map<?, ?> root, FieldSpec field) {
        BigDecimal total = BigDecimal.ZERO;
        for (List<String> constituent : field.getConstituents()) {
            Optional<Object> raw = read(root, constituent);
            if (raw.isPresent()) {
                Object value = coerce(field, raw.get());
                total = total.add((BigDecimal) value);
            }
        }
        return total;
    }

    /** Empty when any segment is absent or null; fails when an intermediate is not an object. */
    private Optional<Object> read(Map<?, ?> root, List<String> path) {
        Object current = root;
        for (int i = 0; i < path.size(); i++) {
            if (!(current instanceof Map<?, ?> map)) {
                throw new MalformedPayloadException(
                        String.join(".", path.subList(0, i)) + " is not an object");
            }
            current = map.get(path.get(i));
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }

    private Object coerce(FieldSpec field, Object raw) {
        switch (field.getValueKind()) {
            case NUMBER:
                if (raw instanceof BigDecimal number) {
                    return number;
                }
                if (raw instanceof Number number) {
                    return toDecimal(field, number);
                }
                if (raw instanceof String text) {
                    if (text.isBlank()) {
                        return field.getDefaultValue();
                    }
                    return IndianNumberFormat.parse(text)
                            .orElseThrow(() -> new MalformedPayloadException(
                                    field.getName() + " is not numeric: " + text));
                }
                throw new MalformedPayloadException(field.getName() + " is not numeric");
            case BOOLEAN:
                if (raw instanceof Boolean flag) {
                    return flag;
                }
                throw new MalformedPayloadException(field.getName() + " is not a boolean");
            case STRING:
            default:
                if (raw instanceof String text) {
                    return text;
                }
                if (raw instanceof Number number) {
                    return number.toString();
                }
                throw new MalformedPayloadException(field.getName() + " is not a string");
        }
    }

    /** NaN and infinities are not amounts. */
    private static BigDecimal toDecimal(FieldSpec field, Number number) {
        try {
            return new BigDecimal(number.toString());
        } catch (NumberFormatException e) {
            throw new MalformedPayloadException(field.getName() + " is not a finite number: " + number);
        }
    }

    @SuppressWarnings("unchecked")
    private void write(Map<String, Object> root, List<String> path, Object value) {
        Map<String, Object> current = root;
        for (int i = 0; i < path.size() - 1; i++) {
            current = (Map<String, Object>) current.computeIfAbsent(path.get(i), key -> new LinkedHashMap<>());
        }
        current.put(path.get(path.size() - 1), value);
    }
}
