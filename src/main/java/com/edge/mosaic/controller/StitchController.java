package com.edge.mosaic.controller;

import com.edge.mosaic.core.raster.RasterReadException;
import com.edge.mosaic.dto.StitchPairRequest;
import com.edge.mosaic.dto.StitchPairResponse;
import com.edge.mosaic.service.StitchService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;

/**
 * 图像对配准控制器
 * <p>
 * 单次只处理一对图像；批量拼接由调用方编排
 */
@RestController
@RequestMapping("/api/stitch")
@Tag(name = "图像配准", description = "两幅重叠图像的仿射变换估计，以及当前配准参数查询")
public class StitchController {
    private static final Logger logger = LoggerFactory.getLogger(StitchController.class);

    @Autowired
    private StitchService stitchService;

    /**
     * 配准一对图像
     */
    @PostMapping("/pair")
    @Operation(
            summary = "配准一对图像",
            description = """
                    按文件路径加载两幅图像，估计把 img1 映射到 img0 的仿射变换。

                    **请求字段说明**：
                    | 字段 | 类型 | 说明 |
                    |------|------|------|
                    | img0 | string | 参考图像路径 |
                    | img1 | string | 待配准图像路径 |
                    | verbose | boolean | 诊断信息中附带特征点数、内点坐标、各尺度尝试记录 |
                    | showPath | string | 可视化输出基础路径，须为 output-dir 下的相对路径；生成 {showPath}_match.png，找到变换时再生成 {showPath}_overlay.png |

                    两幅图像没有重叠时不是错误：`found=false`，`transform=null`，诊断信息中有 n_match 但没有 n_inlier。
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "配准完成（可能未找到变换）",
                    content = @Content(
                            mediaType = "application/json",
                            examples = @ExampleObject(
                                    value = """
                                            {
                                              "status": "success",
                                              "data": {
                                                "found": true,
                                                "transform": [1.222, -0.111, 166.67, 0.111, 1.222, -44.44],
                                                "scale": 0.5,
                                                "diagnostics": {
                                                  "img0": "data/a.png",
                                                  "img1": "data/b.png",
                                                  "n_match": 412,
                                                  "scale": 0.5,
                                                  "n_inlier": 287
                                                }
                                              }
                                            }
                                            """
                            )
                    )
            ),
            @ApiResponse(responseCode = "400", description = "图像不存在、无法解码或参数非法")
    })
    public ResponseEntity<Map<String, Object>> stitchPair(@RequestBody StitchPairRequest request) {
        Map<String, Object> response = new HashMap<>();
        try {
            StitchPairResponse result = stitchService.stitchPair(request);
            response.put("status", "success");
            response.put("data", result);
            return ResponseEntity.ok(response);
        } catch (RasterReadException | IllegalArgumentException e) {
            logger.warn("Invalid stitch request: {}", e.getMessage());
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.badRequest().body(response);
        } catch (Exception e) {
            logger.error("Failed to stitch pair", e);
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
        }
    }

    /**
     * 获取当前生效的配准参数
     */
    @GetMapping("/config")
    @Operation(summary = "获取配准参数", description = "返回当前生效的尺度列表、裁剪窗口、缓存目录、特征/匹配/RANSAC 参数")
    public ResponseEntity<Map<String, Object>> getConfig() {
        Map<String, Object> response = new HashMap<>();
        try {
            response.put("status", "success");
            response.put("data", stitchService.getConfig());
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.error("Failed to get config", e);
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
        }
    }
}
