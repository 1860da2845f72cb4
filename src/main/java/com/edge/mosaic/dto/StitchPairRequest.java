package com.edge.mosaic.dto;

/**
 * 图像对配准请求
 */
public class StitchPairRequest {
    private String img0;          // 参考图像路径
    private String img1;          // 待配准图像路径
    private boolean verbose = false;
    private String showPath;      // 可视化输出的基础路径，相对路径落在 output-dir 下；为空则不输出

    public StitchPairRequest() {
    }

    public StitchPairRequest(String img0, String img1) {
        this.img0 = img0;
        this.img1 = img1;
    }

    public String getImg0() { return img0; }
    public void setImg0(String img0) { this.img0 = img0; }

    public String getImg1() { return img1; }
    public void setImg1(String img1) { this.img1 = img1; }

    public boolean isVerbose() { return verbose; }
    public void setVerbose(boolean verbose) { this.verbose = verbose; }

    public String getShowPath() { return showPath; }
    public void setShowPath(String showPath) { this.showPath = showPath; }
}
