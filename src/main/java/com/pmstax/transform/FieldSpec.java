package com.pmstax.transform;

import com.pmstax.domain.enums.FieldType;
import com.pmstax.domain.enums.ValueKind;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

/**
 * Declarative description of one flat-form field.
 *
 * <p>Three flavours:
 * <ul>
 *   <li>plain: read from {@code path} (then each of {@code fallbackPaths}), written back to {@code path}</li>
 *   <li>aggregate: the sum of nested {@code constituents}, written back as a whole to {@code writeBackPath}</li>
 *   <li>derived: the sum of other flat fields ({@code sourceFields}), read-only and never written back</li>
 * </ul>
 */
@Getter
@Builder(toBuilder = true)
public class FieldSpec {

    private final String name;
    private final List<String> path;

    @Singular
    private final List<List<String>> fallbackPaths;

    private final ValueKind valueKind;
    private final FieldType fieldType;
    private final Object defaultValue;

    @Singular
    private final List<String> options;

    @Singular
    private final List<List<String>> constituents;

    private final List<String> writeBackPath;

    @Singular
    private final List<String> sourceFields;

    public boolean isAggregate() {
        return !constituents.isEmpty();
    }

    public boolean isDerived() {
        return !sourceFields.isEmpty();
    }

    /** Derived fields are display-only. */
    public boolean isReadOnly() {
        return isDerived();
    }

    public String getDottedPath() {
        List<String> target = isAggregate() ? writeBackPath : path;
        return target == null ? name : String.join(".", target);
    }

    static List<String> parsePath(String dotted) {
        return List.of(dotted.split("\\."));
    }
}
