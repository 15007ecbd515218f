package com.swiftload.loadservice.mapper;

import com.swiftload.loadservice.dto.BidResponse;
import com.swiftload.loadservice.model.Bid;
import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface BidMapper {

    BidResponse toBidResponse(Bid bid);
}
