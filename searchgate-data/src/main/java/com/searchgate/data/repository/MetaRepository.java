package com.searchgate.data.repository;

import com.searchgate.data.entity.MetaEntity;
import org.springframework.data.repository.CrudRepository;

import java.util.Optional;

public interface MetaRepository extends CrudRepository<MetaEntity, Long> {

    Optional<MetaEntity> findByMetaKey(String metaKey);
}
