package com.example.commitnotifier.mapper;

import com.example.commitnotifier.domain.entity.TrackedRepository;
import com.example.commitnotifier.dto.RepositoryResponse;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

import java.util.List;

/**
 * MapStruct mapper for tracked repositories
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface RepositoryMapper {

    @Mapping(target = "notificationIntervalHours", source = "notificationInterval.hours")
    RepositoryResponse toResponse(TrackedRepository repository);

    List<RepositoryResponse> toResponseList(List<TrackedRepository> repositories);
}
