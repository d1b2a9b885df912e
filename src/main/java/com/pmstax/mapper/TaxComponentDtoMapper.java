package com.pmstax.mapper;

import com.pmstax.api.dto.response.AggregateCheckResponse;
import com.pmstax.api.dto.response.ComponentSchemaResponse;
import com.pmstax.api.dto.response.FieldSpecResponse;
import com.pmstax.api.dto.response.FieldStateResponse;
import com.pmstax.api.dto.response.SaveComponentResponse;
import com.pmstax.domain.enums.FieldType;
import com.pmstax.revision.SaveResult;
import com.pmstax.rules.AggregateCheck;
import com.pmstax.session.FieldState;
import com.pmstax.transform.ComponentSchema;
import com.pmstax.transform.FieldSpec;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper from engine results to API response DTOs.
 */
@Mapper(imports = FieldType.class)
public interface TaxComponentDtoMapper {

    FieldStateResponse toResponse(FieldState fieldState);

    @Mapping(source = "group.label", target = "label")
    AggregateCheckResponse toResponse(AggregateCheck check);

    List<AggregateCheckResponse> toAggregateResponses(List<AggregateCheck> checks);

    @Mapping(target = "unsavedFields", ignore = true)
    SaveComponentResponse toResponse(SaveResult result);

    @Mapping(source = "dottedPath", target = "path")
    @Mapping(target = "amountLike", expression = "java(FieldType.isAmountLike(fieldSpec.getFieldType().getTag()))")
    FieldSpecResponse toResponse(FieldSpec fieldSpec);

    @Mapping(source = "kind.pathSegment", target = "pathSegment")
    @Mapping(source = "kind.label", target = "label")
    ComponentSchemaResponse toResponse(ComponentSchema schema);
}
