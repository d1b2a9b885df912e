package com.pmstax.gateway;

import com.pmstax.domain.enums.ComponentKind;
import com.pmstax.domain.model.ComponentKey;
import com.pmstax.revision.ComponentUpdateRequest;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence boundary for tax components. All reads and writes of component records
 * go through this interface.
 *
 * <p>Two implementations exist:
 * <ul>
 *   <li>{@link RestTaxComponentGateway}: the payroll back end's taxation API over HTTP</li>
 *   <li>{@link InMemoryTaxComponentGateway}: revision histories kept in process, for local runs and tests</li>
 * </ul>
 *
 * <p>The active implementation is selected with {@code pmstax.gateway.mode}.
 */
public interface TaxComponentGateway {

    /**
     * Fetches the nested record of the active revision.
     *
     * @return empty when no record exists for the key (HTTP 404)
     * @throws com.pmstax.exception.GatewayException if the back end cannot be reached or fails
     */
    Optional<Map<String, Object>> getComponent(ComponentKey key);

    /**
     * Updates the active revision or, when {@code forceNewRevision} is set, opens a new one.
     *
     * @return the stored revision as reported by the back end
     * @throws com.pmstax.exception.ComponentValidationException if the back end rejects the data
     * @throws com.pmstax.exception.GatewayException on transport or server failure
     */
    Map<String, Object> updateComponent(ComponentKind kind, ComponentUpdateRequest request);
}
