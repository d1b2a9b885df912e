package com.pmstax.api.controller;

import com.pmstax.api.dto.request.AggregateCheckRequest;
import com.pmstax.api.dto.response.AggregateCheckResponse;
import com.pmstax.domain.model.TaxYear;
import com.pmstax.domain.model.ValidationContext;
import com.pmstax.mapper.TaxComponentDtoMapper;
import com.pmstax.rules.StatutoryLimits;
import com.pmstax.rules.StatutoryRuleTable;
import jakarta.validation.Valid;
import org.mapstruct.factory.Mappers;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read access to the statutory rule table.
 *
 * <ul>
 *   <li>{@code GET /api/rules/{taxYear}/limits} -- every limit in force for the year</li>
 *   <li>{@code POST /api/rules/{taxYear}/aggregate-check} -- one group's total against its ceiling</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/rules")
public class RulesController {

    private final StatutoryRuleTable ruleTable;
    private final TaxComponentDtoMapper dtoMapper = Mappers.getMapper(TaxComponentDtoMapper.class);

    public RulesController(StatutoryRuleTable ruleTable) {
        this.ruleTable = ruleTable;
    }

    @GetMapping("/{taxYear}/limits")
    public StatutoryLimits getLimits(@PathVariable String taxYear) {
        return ruleTable.limitsFor(TaxYear.parse(taxYear));
    }

    @PostMapping("/{taxYear}/aggregate-check")
    public AggregateCheckResponse checkAggregate(
            @PathVariable String taxYear, @Valid @RequestBody AggregateCheckRequest request) {
        ValidationContext context = ValidationContext.builder()
                .aggregateGroup(request.getGroup())
                .employeeAge(request.getEmployeeAge())
                .parentsAge(request.getParentsAge())
                .severeDisability(request.isSevereDisability())
                .build();
        return dtoMapper.toResponse(
                ruleTable.checkAggregateLimit(request.getGroup(), request.getValues(), context, TaxYear.parse(taxYear)));
    }
}
