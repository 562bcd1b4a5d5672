package com.example.cpt;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * CPT编码抽取工具主启动类
 *
 * 功能特性:
 * - EPUB页码索引与缓存
 * - 按页码区间/章节切分抽取
 * - 流式或批量调用生成模型
 * - JSONL结果导出为CSV
 */
@SpringBootApplication
public class CptExtractorApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(CptExtractorApplication.class, args);
        System.exit(SpringApplication.exit(context));
    }
}
