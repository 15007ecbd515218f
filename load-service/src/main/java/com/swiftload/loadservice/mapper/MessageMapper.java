package com.swiftload.loadservice.mapper;

import com.swiftload.loadservice.dto.MessageResponse;
import com.swiftload.loadservice.model.Message;
import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface MessageMapper {

    MessageResponse toMessageResponse(Message message);
}
