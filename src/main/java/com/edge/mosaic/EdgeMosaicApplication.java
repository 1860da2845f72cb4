package com.edge.mosaic;

import com.edge.mosaic.config.NativeLibraryLoader;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EdgeMosaicApplication {

    public static void main(String[] args) {
        // OpenCV 必须在任何 Mat 创建之前加载
        NativeLibraryLoader.loadNativeLibraries();
        SpringApplication.run(EdgeMosaicApplication.class, args);
    }
}
