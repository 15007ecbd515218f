package com.swiftload.loadservice.mapper;

import com.swiftload.loadservice.dto.LoadRequest;
import com.swiftload.loadservice.dto.LoadResponse;
import com.swiftload.loadservice.dto.LoadTermsRequest;
import com.swiftload.loadservice.model.Load;
import org.mapstruct.Mapper;
import org.mapstruct.MappingTarget;
import org.mapstruct.NullValuePropertyMappingStrategy;
import org.mapstruct.ReportingPolicy;

@Mapper(componentModel = "spring"
        , unmappedTargetPolicy = ReportingPolicy.IGNORE
        , nullValuePropertyMappingStrategy = NullValuePropertyMappingStrategy.IGNORE)
public interface LoadMapper {

    /**
     * @param request the posted terms
     * @return a new load entity; owner, status and audit fields are set by the service
     */
    Load toLoad(LoadRequest request);

    LoadResponse toLoadResponse(Load load);

    /**
     * Copies the non-null terms onto an existing load.
     */
    void updateLoadFromRequest(LoadTermsRequest request, @MappingTarget Load load);
}
