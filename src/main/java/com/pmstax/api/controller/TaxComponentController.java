package com.pmstax.api.controller;

import com.pmstax.api.dto.request.FieldInputRequest;
import com.pmstax.api.dto.request.SaveComponentRequest;
import com.pmstax.api.dto.response.AggregateCheckResponse;
import com.pmstax.api.dto.response.ComponentFormResponse;
import com.pmstax.api.dto.response.ComponentSchemaResponse;
import com.pmstax.api.dto.response.FieldStateResponse;
import com.pmstax.api.dto.response.SaveComponentResponse;
import com.pmstax.domain.enums.ComponentKind;
import com.pmstax.domain.enums.RevisionMode;
import com.pmstax.domain.model.ComponentKey;
import com.pmstax.domain.model.TaxYear;
import com.pmstax.mapper.TaxComponentDtoMapper;
import com.pmstax.revision.SaveResult;
import com.pmstax.rules.AggregateCheck;
import com.pmstax.session.ComponentEditSession;
import com.pmstax.session.EditSessionFactory;
import com.pmstax.session.FieldState;
import com.pmstax.transform.ComponentSchemas;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.mapstruct.factory.Mappers;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for editing one tax component of one employee and tax year.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET /api/tax-components/{employeeId}/{taxYear}/{kind}} -- flat form and running totals (defaults when nothing is stored)</li>
 *   <li>{@code POST /api/tax-components/{employeeId}/{taxYear}/{kind}/fields} -- apply one field edit and validate it</li>
 *   <li>{@code POST /api/tax-components/{employeeId}/{taxYear}/{kind}/aggregates} -- ceiling checks for the posted form</li>
 *   <li>{@code PUT /api/tax-components/{employeeId}/{taxYear}/{kind}} -- save as update or new revision</li>
 *   <li>{@code GET /api/tax-components/schema/{kind}} -- field list of a component</li>
 * </ul>
 *
 * <p>Each request works on a fresh edit session; the client holds the form between calls.
 */
@RestController
@RequestMapping("/api/tax-components")
public class TaxComponentController {

    private final EditSessionFactory sessionFactory;
    private final TaxComponentDtoMapper dtoMapper = Mappers.getMapper(TaxComponentDtoMapper.class);

    public TaxComponentController(EditSessionFactory sessionFactory) {
        this.sessionFactory = sessionFactory;
    }

    @GetMapping("/{employeeId}/{taxYear}/{kind}")
    public ComponentFormResponse getComponent(
            @PathVariable String employeeId,
            @PathVariable String taxYear,
            @PathVariable String kind,
            @RequestParam(required = false) String mode,
            @RequestParam(required = false) Integer employeeAge,
            @RequestParam(required = false) Integer parentsAge) {
        ComponentEditSession session = sessionFactory.open(keyOf(employeeId, taxYear, kind), RevisionMode.fromFlag(mode));
        // ages only move the senior citizen ceilings in the summary
        session.setEmployeeAge(employeeAge);
        session.setParentsAge(parentsAge);
        return toFormResponse(session);
    }

    @PostMapping("/{employeeId}/{taxYear}/{kind}/fields")
    public FieldStateResponse editField(
            @PathVariable String employeeId,
            @PathVariable String taxYear,
            @PathVariable String kind,
            @Valid @RequestBody FieldInputRequest request) {
        ComponentEditSession session = sessionFactory
                .create(keyOf(employeeId, taxYear, kind), RevisionMode.UPDATE)
                .applyValues(request.getValues());
        session.setEmployeeAge(request.getEmployeeAge());
        session.setParentsAge(request.getParentsAge());
        session.setRentPaid(request.getRentPaid());

        session.focus(request.getField());
        FieldState typed = session.input(request.getField(), request.getValue());
        if (!typed.isAccepted()) {
            return dtoMapper.toResponse(typed);
        }
        return dtoMapper.toResponse(session.blur(request.getField()));
    }

    @PostMapping("/{employeeId}/{taxYear}/{kind}/aggregates")
    public List<AggregateCheckResponse> checkAggregates(
            @PathVariable String employeeId,
            @PathVariable String taxYear,
            @PathVariable String kind,
            @RequestBody Map<String, Object> values) {
        ComponentEditSession session =
                sessionFactory.create(keyOf(employeeId, taxYear, kind), RevisionMode.UPDATE).applyValues(values);
        List<AggregateCheck> checks = session.checkAggregates();
        return dtoMapper.toAggregateResponses(checks);
    }

    @PutMapping("/{employeeId}/{taxYear}/{kind}")
    public SaveComponentResponse saveComponent(
            @PathVariable String employeeId,
            @PathVariable String taxYear,
            @PathVariable String kind,
            @Valid @RequestBody SaveComponentRequest request) {
        ComponentEditSession session = sessionFactory
                .create(keyOf(employeeId, taxYear, kind), RevisionMode.fromFlag(request.getMode()))
                .applyValues(request.getValues());
        SaveResult result = session.save(request.getEffectiveFrom(), request.getNotes());
        SaveComponentResponse response = dtoMapper.toResponse(result);
        response.setUnsavedFields(session.fieldsWithErrors());
        return response;
    }

    @GetMapping("/schema/{kind}")
    public ComponentSchemaResponse getSchema(@PathVariable String kind) {
        return dtoMapper.toResponse(ComponentSchemas.forKind(ComponentKind.fromPathSegment(kind)));
    }

    private static ComponentKey keyOf(String employeeId, String taxYear, String kind) {
        return ComponentKey.of(employeeId, TaxYear.parse(taxYear), ComponentKind.fromPathSegment(kind));
    }

    private static ComponentFormResponse toFormResponse(ComponentEditSession session) {
        ComponentKey key = session.getKey();
        return ComponentFormResponse.builder()
                .employeeId(key.getEmployeeId())
                .taxYear(key.getTaxYear().toString())
                .kind(key.getKind().getPathSegment())
                .mode(session.getMode().name())
                .values(session.getForm().asMap())
                .summary(session.summarize())
                .notice(session.getNotice())
                .banner(session.getBanner())
                .build();
    }
}
