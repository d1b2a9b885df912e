package com.pmstax.transform;

import com.pmstax.domain.enums.ComponentKind;
import com.pmstax.domain.enums.FieldType;
import com.pmstax.domain.enums.ValueKind;
import com.pmstax.domain.model.FlatForm;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;

/**
 * Ordered field list of one component kind, with a small builder DSL used by
 * {@link ComponentSchemas}.
 */
public class ComponentSchema {

    @Getter
    private final ComponentKind kind;

    @Getter
    private final List<FieldSpec> fields;

    private final Map<String, FieldSpec> byName;

    private ComponentSchema(ComponentKind kind, List<FieldSpec> fields) {
        this.kind = kind;
        this.fields = Collections.unmodifiableList(fields);
        Map<String, FieldSpec> index = new LinkedHashMap<>();
        for (FieldSpec field : fields) {
            if (index.put(field.getName(), field) != null) {
                throw new IllegalStateException("Duplicate field " + field.getName() + " in " + kind + " schema");
            }
        }
        this.byName = Collections.unmodifiableMap(index);
    }

    public Optional<FieldSpec> field(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public FieldSpec requireField(String name) {
        FieldSpec spec = byName.get(name);
        if (spec == null) {
            throw new IllegalArgumentException("Unknown " + kind.getLabel() + " field: " + name);
        }
        return spec;
    }

    /** A flat form holding every field's default, derived fields included. */
    public FlatForm defaults() {
        FlatForm form = new FlatForm();
        for (FieldSpec field : fields) {
            form.put(field.getName(), field.getDefaultValue());
        }
        return form;
    }

    public static Builder builder(ComponentKind kind) {
        return new Builder(kind);
    }

    public static final class Builder {

        private final ComponentKind kind;
        private final List<FieldSpec> fields = new ArrayList<>();

        private Builder(ComponentKind kind) {
            this.kind = kind;
        }

        /** Amount stored under the same name at the root of the record. */
        public Builder amount(String name) {
            return number(name, name, FieldType.AMOUNT, BigDecimal.ZERO);
        }

        public Builder amount(String name, String path) {
            return number(name, path, FieldType.AMOUNT, BigDecimal.ZERO);
        }

        public Builder number(String name, String path, FieldType fieldType, BigDecimal defaultValue) {
            return add(FieldSpec.builder()
                    .name(name)
                    .path(FieldSpec.parsePath(path))
                    .valueKind(ValueKind.NUMBER)
                    .fieldType(fieldType)
                    .defaultValue(defaultValue)
                    .build());
        }

        public Builder select(String name, String path, String defaultValue, List<String> options) {
            return add(FieldSpec.builder()
                    .name(name)
                    .path(FieldSpec.parsePath(path))
                    .valueKind(ValueKind.STRING)
                    .fieldType(FieldType.SELECT)
                    .defaultValue(defaultValue)
                    .options(options)
                    .build());
        }

        public Builder text(String name, String path, String defaultValue) {
            return add(FieldSpec.builder()
                    .name(name)
                    .path(FieldSpec.parsePath(path))
                    .valueKind(ValueKind.STRING)
                    .fieldType(FieldType.TEXT)
                    .defaultValue(defaultValue)
                    .build());
        }

        public Builder flag(String name, String path, boolean defaultValue) {
            return add(FieldSpec.builder()
                    .name(name)
                    .path(FieldSpec.parsePath(path))
                    .valueKind(ValueKind.BOOLEAN)
                    .fieldType(FieldType.SELECT)
                    .defaultValue(defaultValue)
                    .build());
        }

        /** Adds a fallback read path to the most recently declared field. */
        public Builder fallback(String path) {
            int last = fields.size() - 1;
            FieldSpec previous = fields.get(last);
            fields.set(last, previous.toBuilder().fallbackPath(FieldSpec.parsePath(path)).build());
            return this;
        }

        /**
         * Sum of several leaves of one sub-record, edited as a single amount. The edited
         * total is written back to {@code writeBackLeaf} and the other constituents are
         * written as zero, so the total survives a merge on the server.
         */
        public Builder aggregate(String name, String subRecord, List<String> constituentLeaves, String writeBackLeaf) {
            if (!constituentLeaves.contains(writeBackLeaf)) {
                throw new IllegalArgumentException(writeBackLeaf + " is not a constituent of " + name);
            }
            FieldSpec.FieldSpecBuilder spec = FieldSpec.builder()
                    .name(name)
                    .valueKind(ValueKind.NUMBER)
                    .fieldType(FieldType.AMOUNT)
                    .defaultValue(BigDecimal.ZERO)
                    .writeBackPath(List.of(subRecord, writeBackLeaf));
            for (String leaf : constituentLeaves) {
                spec.constituent(List.of(subRecord, leaf));
            }
            return add(spec.build());
        }

        /** Read-only sum of other (already declared) flat fields. */
        public Builder derived(String name, String... sourceFields) {
            FieldSpec.FieldSpecBuilder spec = FieldSpec.builder()
                    .name(name)
                    .valueKind(ValueKind.NUMBER)
                    .fieldType(FieldType.AMOUNT)
                    .defaultValue(BigDecimal.ZERO);
            for (String source : sourceFields) {
                boolean declared = fields.stream().anyMatch(f -> f.getName().equals(source));
                if (!declared) {
                    throw new IllegalArgumentException("Derived field " + name + " uses undeclared field " + source);
                }
                spec.sourceField(source);
            }
            return add(spec.build());
        }

        private Builder add(FieldSpec spec) {
            fields.add(spec);
            return this;
        }

        public ComponentSchema build() {
            return new ComponentSchema(kind, new ArrayList<>(fields));
        }
    }
}
