package com.positionalert.engine.infrastructure.db.mapper;

import com.positionalert.engine.domain.alert.AlertRecord;
import com.positionalert.engine.infrastructure.db.AlertStateEntity;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface AlertStateEntityMapper {

    @Mapping(target = "id", ignore = true)
    AlertStateEntity toEntity(AlertRecord record);

    AlertRecord toDomain(AlertStateEntity entity);
}
