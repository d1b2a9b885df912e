package com.pmstax.session;

import com.pmstax.domain.enums.RevisionMode;
import com.pmstax.domain.model.ComponentKey;
import com.pmstax.gateway.TaxComponentGateway;
import com.pmstax.observability.TaxEngineMetrics;
import com.pmstax.revision.RevisionController;
import com.pmstax.rules.StatutoryRuleTable;
import com.pmstax.transform.ComponentFlattener;
import com.pmstax.validation.FieldValidator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Creates edit sessions wired to the application's collaborators. */
@Component
@RequiredArgsConstructor
public class EditSessionFactory {

    private final ComponentFlattener flattener;
    private final FieldValidator validator;
    private final StatutoryRuleTable ruleTable;
    private final RevisionController revisionController;
    private final TaxComponentGateway gateway;
    private final TaxEngineMetrics metrics;

    /** A session holding defaults; call {@link ComponentEditSession#load()} to fetch the stored record. */
    public ComponentEditSession create(ComponentKey key, RevisionMode mode) {
        return new ComponentEditSession(key, mode, flattener, validator, ruleTable, revisionController, gateway, metrics);
    }

    public ComponentEditSession open(ComponentKey key, RevisionMode mode) {
        return create(key, mode).load();
    }
}
