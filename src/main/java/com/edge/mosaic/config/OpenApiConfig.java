package com.edge.mosaic.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.responses.ApiResponse;
import org.springdoc.core.customizers.OpenApiCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * OpenAPI / Swagger 配置
 *
 * 访问地址：
 * - Swagger UI: http://localhost:{port}/swagger-ui.html
 * - API 文档 (JSON): http://localhost:{port}/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI edgeMosaicOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Edge Mosaic API")
                        .description("""
                                图像对仿射配准 API 文档

                                ## 功能概述

                                对两幅有重叠的灰度图像估计仿射变换，用于后续拼接成大图。

                                ### 处理流程
                                - **特征提取**：SIFT 关键点与描述子，按路径缓存
                                - **特征匹配**：最近邻 / 次近邻比值检验
                                - **鲁棒拟合**：RANSAC 仿射拟合 + 内点最小二乘精化
                                - **多尺度重试**：按配置的尺度顺序依次尝试，第一个成功即停止

                                ### 变换方向
                                返回的 6 个系数 `[a, b, c, d, e, f]` 把 img1 的像素坐标映射到 img0：
                                `x0 = a*x1 + b*y1 + c`，`y0 = d*x1 + e*y1 + f`

                                ### API 响应格式
                                所有接口返回统一的 JSON 格式：
                                ```json
                                {
                                  "status": "success | error",
                                  "data": { ... },
                                  "message": "错误信息（仅错误时）"
                                }
                                ```
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Edge Mosaic Team"))
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")));
    }

    /**
     * 为所有接口添加统一的响应示例
     */
    @Bean
    public OpenApiCustomizer globalResponseCustomizer() {
        return openApi -> openApi.getPaths().forEach((path, pathItem) -> {
            if (pathItem.getGet() != null) {
                pathItem.getGet().getResponses().addApiResponse("200", createSuccessResponse());
            }
            if (pathItem.getPost() != null) {
                pathItem.getPost().getResponses().addApiResponse("200", createSuccessResponse());
                pathItem.getPost().getResponses().addApiResponse("400", createBadRequestResponse());
            }
        });
    }

    private ApiResponse createSuccessResponse() {
        Schema<?> schema = new Schema<>();
        schema.setType("object");
        schema.setProperties(Map.of(
                "status", new Schema<>().type("string").description("状态: success/error").example("success"),
                "data", new Schema<>().type("object").description("响应数据"),
                "message", new Schema<>().type("string").description("消息（可选）")
        ));

        return new ApiResponse()
                .description("成功")
                .content(new Content()
                        .addMediaType("application/json",
                                new MediaType().schema(schema)));
    }

    private ApiResponse createBadRequestResponse() {
        Schema<?> schema = new Schema<>();
        schema.setType("object");
        schema.setProperties(Map.of(
                "status", new Schema<>().type("string").description("状态").example("error"),
                "message", new Schema<>().type("string").description("错误信息").example("Image not found: a.png")
        ));

        return new ApiResponse()
                .description("请求错误（图像不存在、无法解码或参数非法）")
                .content(new Content()
                        .addMediaType("application/json",
                                new MediaType().schema(schema)));
    }
}
