package com.pmstax.session;

import com.pmstax.calculator.CalculatorField;
import com.pmstax.calculator.ExpressionException;
import com.pmstax.calculator.IndianNumberFormat;
import com.pmstax.calculator.InputOutcome;
import com.pmstax.domain.enums.AggregateGroup;
import com.pmstax.domain.enums.ComponentKind;
import com.pmstax.domain.enums.RevisionMode;
import com.pmstax.domain.enums.ValueKind;
import com.pmstax.domain.model.ComponentKey;
import com.pmstax.domain.model.FlatForm;
import com.pmstax.domain.model.ValidationContext;
import com.pmstax.exception.BusinessException;
import com.pmstax.exception.ErrorCode;
import com.pmstax.exception.GatewayException;
import com.pmstax.exception.ResourceNotFoundException;
import com.pmstax.gateway.TaxComponentGateway;
import com.pmstax.observability.TaxEngineMetrics;
import com.pmstax.revision.RevisionController;
import com.pmstax.revision.SaveCommand;
import com.pmstax.revision.SaveResult;
import com.pmstax.rules.AggregateCheck;
import com.pmstax.rules.StatutoryRuleTable;
import com.pmstax.summary.ComponentSummaryCalculator;
import com.pmstax.transform.ComponentFlattener;
import com.pmstax.transform.ComponentSchema;
import com.pmstax.transform.ComponentSchemas;
import com.pmstax.transform.FieldSpec;
import com.pmstax.transform.FlattenResult;
import com.pmstax.validation.FieldValidationResult;
import com.pmstax.validation.FieldValidator;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Editing state of one component for one employee and tax year.
 *
 * <p>The session owns the flat form, one {@link CalculatorField} per editable field and
 * the latest advisory result per field. Values reach the form on blur; derived fields
 * are recomputed after every commit. Warnings never block a save. A pending expression
 * that fails to evaluate keeps its field's last committed value out of the way of the
 * others: the rest of the form is still saved.
 *
 * <p>Not thread-safe. Loads are not cancelled; when two loads race the one that
 * finishes last wins.
 */
public class ComponentEditSession {

    private static final Logger log = LoggerFactory.getLogger(ComponentEditSession.class);

    @Getter
    private final ComponentKey key;

    @Getter
    private final RevisionMode mode;

    private final ComponentSchema schema;
    private final ComponentFlattener flattener;
    private final FieldValidator validator;
    private final StatutoryRuleTable ruleTable;
    private final RevisionController revisionController;
    private final TaxComponentGateway gateway;
    private final TaxEngineMetrics metrics;

    private final Map<String, CalculatorField> calculators = new LinkedHashMap<>();
    private final Map<String, FieldValidationResult> results = new LinkedHashMap<>();

    @Getter
    private FlatForm form;

    /** Error banner for load or save failures; null when there is nothing to report. */
    @Getter
    private String banner;

    /** Info notice, e.g. that defaults are shown. */
    @Getter
    private String notice;

    @Getter
    @Setter
    private Integer employeeAge;

    @Getter
    @Setter
    private Integer parentsAge;

    /** Rent paid, used for the HRA breakdown on salary forms. */
    @Getter
    @Setter
    private BigDecimal rentPaid;

    ComponentEditSession(
            ComponentKey key,
            RevisionMode mode,
            ComponentFlattener flattener,
            FieldValidator validator,
            StatutoryRuleTable ruleTable,
            RevisionController revisionController,
            TaxComponentGateway gateway,
            TaxEngineMetrics metrics) {
        this.key = key;
        this.mode = mode;
        this.schema = ComponentSchemas.forKind(key.getKind());
        this.flattener = flattener;
        this.validator = validator;
        this.ruleTable = ruleTable;
        this.revisionController = revisionController;
        this.gateway = gateway;
        this.metrics = metrics;
        resetTo(flattener.defaults(key.getKind()));
    }

    /**
     * Loads the stored record into the form. A missing record shows defaults with an
     * info notice; any other failure shows defaults with an error banner. A new
     * revision always starts from defaults.
     */
    public ComponentEditSession load() {
        ComponentKind kind = key.getKind();
        banner = null;
        if (mode == RevisionMode.NEW_REVISION) {
            resetTo(flattener.defaults(kind));
            notice = "Creating new " + kind.getLabel() + " revision. Enter the updated " + kind.getLabel() + " data.";
            return this;
        }
        try {
            Optional<Map<String, Object>> stored = gateway.getComponent(key);
            FlattenResult result = flattener.flatten(kind, stored.orElse(null));
            resetTo(result.getForm());
            if (result.isDataFound()) {
                notice = null;
                log.info("Loaded {} for {}", kind, key);
            } else {
                notice = "No existing " + kind.getLabel() + " data found. Creating new record.";
                metrics.recordLoadFallback(kind.name(), stored.isPresent() ? "malformed" : "not_found");
            }
        } catch (GatewayException e) {
            log.error("Loading {} failed", key, e);
            resetTo(flattener.defaults(kind));
            notice = null;
            banner = "Failed to load " + kind.getLabel() + " data. Please try again.";
            metrics.recordLoadFallback(kind.name(), "error");
        }
        return this;
    }

    /**
     * Overlays values posted by a client on the current form, then recomputes derived
     * fields. Numbers may arrive as JSON numbers or as formatted strings. An amount
     * posted as an {@code =} expression is typed into its calculator and stays pending
     * until {@link #save} resolves it; the field keeps its current value meanwhile.
     */
    public ComponentEditSession applyValues(Map<String, Object> values) {
        if (values == null || values.isEmpty()) {
            return this;
        }
        FlatForm updated = FlatForm.copyOf(form);
        Map<String, String> expressions = new LinkedHashMap<>();
        values.forEach((name, raw) -> {
            FieldSpec spec = schema.field(name)
                    .orElseThrow(() -> new BusinessException(
                            ErrorCode.VALIDATION_ERROR, "Unknown " + key.getKind().getLabel() + " field: " + name));
            if (spec.isReadOnly() || raw == null) {
                return;
            }
            if (spec.getValueKind() == ValueKind.NUMBER && raw instanceof String text && text.contains("=")) {
                expressions.put(name, text.trim());
            } else {
                updated.put(name, coerce(spec, raw));
            }
        });
        resetTo(flattener.recomputeDerived(key.getKind(), updated));
        expressions.forEach((name, text) -> calculators.get(name).onInput(text));
        return this;
    }

    public FieldState focus(String field) {
        CalculatorField calculator = editable(field);
        return stateOf(field, calculator.onFocus());
    }

    public FieldState input(String field, String text) {
        CalculatorField calculator = editable(field);
        return stateOf(field, calculator.onInput(text));
    }

    /**
     * Ends editing of a field: evaluates a pending expression, commits the value to the
     * form and validates it. A failed expression or an unreadable number leaves the form
     * untouched and keeps the error on the field.
     */
    public FieldState blur(String field) {
        CalculatorField calculator = editable(field);
        FieldSpec spec = schema.requireField(field);
        InputOutcome outcome = calculator.onBlur();
        if (!outcome.isAccepted()) {
            // the form keeps the last committed value
            if (calculator.isComposing()) {
                metrics.recordExpressionError();
            }
            results.remove(field);
            return stateOf(field, outcome);
        }
        commit(spec, calculator.getBuffer());
        flattener.recomputeDerived(key.getKind(), form);
        results.put(field, validate(spec));
        return stateOf(field, outcome);
    }

    /**
     * Group membership, group total and the personal inputs a check on {@code field}
     * needs, all taken from the form as it is now.
     */
    public ValidationContext validationContextFor(String field) {
        List<AggregateGroup> groups = AggregateGroup.forField(field);
        AggregateGroup group = groups.isEmpty() ? null : groups.get(0);
        BigDecimal total = BigDecimal.ZERO;
        if (group != null) {
            for (String member : group.getMembers()) {
                total = total.add(form.getNumber(member));
            }
        }
        ValidationContext.ValidationContextBuilder context = ValidationContext.builder()
                .aggregateGroup(group)
                .currentTotal(total)
                .currentValue(form.getNumber(field))
                .employeeAge(employeeAge)
                .parentsAge(parentsAge)
                .severeDisability(isSevereDisability(group));
        if (key.getKind() == ComponentKind.SALARY) {
            context.basic(form.getNumber("basic_salary"))
                    .da(form.getNumber("dearness_allowance"))
                    .rentPaid(rentPaid)
                    .city(form.getString("hra_city_type"));
        }
        return context.build();
    }

    /** Running totals of the form as it is now, under the tax year's limits. */
    public Map<String, BigDecimal> summarize() {
        return ComponentSummaryCalculator.summarize(
                key.getKind(), form, ruleTable.limitsFor(key.getTaxYear()), employeeAge, parentsAge);
    }

    /** Ceiling checks of every aggregate group this component has fields in. */
    public List<AggregateCheck> checkAggregates() {
        List<AggregateCheck> checks = new ArrayList<>();
        Map<String, BigDecimal> values = form.numericValues();
        for (AggregateGroup group : AggregateGroup.values()) {
            if (group.getMembers().stream().anyMatch(member -> schema.field(member).isPresent())) {
                ValidationContext context = validationContextFor(group.getMembers().get(0));
                checks.add(ruleTable.checkAggregateLimit(group, values, context, key.getTaxYear()));
            }
        }
        return checks;
    }

    /**
     * Resolves pending expressions, then saves the form. Fields whose expression fails
     * keep their error and last committed value. A failed save sets the banner and
     * leaves the form as it is.
     *
     * @throws com.pmstax.exception.RevisionValidationException if a new revision has no effective date
     */
    public SaveResult save(LocalDate effectiveFrom, String notes) {
        for (Map.Entry<String, CalculatorField> entry : calculators.entrySet()) {
            CalculatorField calculator = entry.getValue();
            if (!calculator.isComposing()) {
                continue;
            }
            FieldSpec spec = schema.requireField(entry.getKey());
            try {
                BigDecimal value = calculator.resolveForSave();
                form.put(spec.getName(), value);
                results.put(spec.getName(), validate(spec));
            } catch (ExpressionException e) {
                metrics.recordExpressionError();
                log.warn("Not saving expression for {}: {}", spec.getName(), e.getMessage());
            }
        }
        flattener.recomputeDerived(key.getKind(), form);

        SaveResult result = revisionController.submit(SaveCommand.builder()
                .key(key)
                .mode(mode)
                .form(FlatForm.copyOf(form))
                .effectiveFrom(effectiveFrom)
                .notes(notes)
                .build());
        if (result.isFailed()) {
            banner = result.getMessage();
        } else {
            banner = null;
            notice = result.getMessage();
        }
        return result;
    }

    public FieldValidationResult resultFor(String field) {
        return results.getOrDefault(field, FieldValidationResult.none());
    }

    public Map<String, FieldValidationResult> getResults() {
        return Collections.unmodifiableMap(results);
    }

    /** Fields that still hold an expression error. */
    public List<String> fieldsWithErrors() {
        List<String> fields = new ArrayList<>();
        calculators.forEach((name, calculator) -> {
            if (calculator.getError() != null) {
                fields.add(name);
            }
        });
        return fields;
    }

    private void resetTo(FlatForm values) {
        form = values;
        calculators.clear();
        results.clear();
        for (FieldSpec spec : schema.getFields()) {
            if (!spec.isReadOnly()) {
                calculators.put(
                        spec.getName(),
                        new CalculatorField(spec.getName(), spec.getFieldType(), display(form.get(spec.getName()))));
            }
        }
    }

    private CalculatorField editable(String field) {
        FieldSpec spec = schema.field(field)
                .orElseThrow(() -> new ResourceNotFoundException(key.getKind().getLabel() + " field", field));
        if (spec.isReadOnly()) {
            throw new BusinessException(ErrorCode.BAD_REQUEST, "Field " + field + " is calculated and cannot be edited");
        }
        return calculators.get(field);
    }

    private void commit(FieldSpec spec, String buffer) {
        String name = spec.getName();
        if (spec.getValueKind() == ValueKind.NUMBER) {
            form.put(name, IndianNumberFormat.parse(buffer).orElse(BigDecimal.ZERO));
        } else if (spec.getValueKind() == ValueKind.BOOLEAN) {
            form.put(name, Boolean.parseBoolean(buffer.trim()));
        } else {
            form.put(name, buffer);
        }
    }

    private Object coerce(FieldSpec spec, Object raw) {
        if (spec.getValueKind() == ValueKind.NUMBER) {
            if (raw instanceof BigDecimal number) {
                return number;
            }
            if (raw instanceof Number number) {
                try {
                    return new BigDecimal(number.toString());
                } catch (NumberFormatException e) {
                    throw notANumber(spec);
                }
            }
            return IndianNumberFormat.parse(String.valueOf(raw)).orElseThrow(() -> notANumber(spec));
        }
        if (spec.getValueKind() == ValueKind.BOOLEAN) {
            return raw instanceof Boolean flag ? flag : Boolean.parseBoolean(String.valueOf(raw).trim());
        }
        return String.valueOf(raw);
    }

    private static BusinessException notANumber(FieldSpec spec) {
        return new BusinessException(ErrorCode.VALIDATION_ERROR, "Field " + spec.getName() + " must be a number");
    }

    private FieldValidationResult validate(FieldSpec spec) {
        if (spec.getValueKind() != ValueKind.NUMBER) {
            return FieldValidationResult.none();
        }
        return validator.validate(
                spec.getFieldType(), form.getNumber(spec.getName()), validationContextFor(spec.getName()), key.getTaxYear());
    }

    private boolean isSevereDisability(AggregateGroup group) {
        if (group == AggregateGroup.SECTION_80DD) {
            return ComponentSchemas.SEVERE_DISABILITY.equals(form.getString("disability_percentage"));
        }
        if (group == AggregateGroup.SECTION_80U) {
            return ComponentSchemas.SEVERE_DISABILITY.equals(form.getString("self_disability_percentage"));
        }
        return false;
    }

    private FieldState stateOf(String field, InputOutcome outcome) {
        FieldValidationResult result = resultFor(field);
        return FieldState.builder()
                .field(field)
                .value(form.get(field))
                .buffer(outcome.getBuffer())
                .state(outcome.getState())
                .accepted(outcome.isAccepted())
                .severity(result.getSeverity())
                .message(result.getMessage())
                .error(outcome.getError())
                .notice(outcome.getNotice())
                .build();
    }

    private static String display(Object value) {
        if (value instanceof BigDecimal number) {
            return IndianNumberFormat.format(number);
        }
        return value == null ? "" : String.valueOf(value);
    }
}
