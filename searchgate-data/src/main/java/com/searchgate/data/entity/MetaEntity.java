package com.searchgate.data.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * 系统元数据（如 rollup 水位线）。
 */
@Table("t_meta")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetaEntity {

    @Id
    private Long id;

    private String metaKey;

    private String metaValue;
}
