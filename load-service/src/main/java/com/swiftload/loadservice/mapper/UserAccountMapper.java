package com.swiftload.loadservice.mapper;

import com.swiftload.loadservice.dto.UserProfileResponse;
import com.swiftload.loadservice.model.UserAccount;
import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface UserAccountMapper {

    UserProfileResponse toUserProfileResponse(UserAccount userAccount);
}
