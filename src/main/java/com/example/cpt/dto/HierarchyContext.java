package com.example.cpt.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 某页生效的四级标题上下文，null 表示该级未解析到
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class HierarchyContext {
    private String section;
    private String subsection;
    private String subheading;
    private String topic;

    public static HierarchyContext unresolved() {
        return new HierarchyContext();
    }

    public boolean isComplete() {
        return section != null && subsection != null && subheading != null && topic != null;
    }
}
