package com.example.cpt.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 页码在EPUB中的位置：所在spine文件及页码锚点
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PageLocation {

    @JsonProperty("file_id")
    private String fileId;

    @JsonProperty("full_path")
    private String fullPath;

    @JsonProperty("anchor_id")
    private String anchorId;
}
