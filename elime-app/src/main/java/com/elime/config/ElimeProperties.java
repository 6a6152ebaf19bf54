package com.elime.config;

import com.elime.model.RenderMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Settings for all ELIME commands.
 * Defaults live in application.yml; override them in ~/.elime.yml or with
 * --elime.* command line options.
 */
@Configuration
@ConfigurationProperties(prefix = "elime")
public class ElimeProperties {

    private String dbFile;
    private String photoFolder;
    private String sourceFolder;
    private String targetFolder;
    private int maxSize = 1024;
    private int zoomSize = 640;
    private String customDateFormat = "";

    private Detection detection = new Detection();
    private Check check = new Check();
    private Render render = new Render();
    private Pre pre = new Pre();

    public String getDbFile() { return dbFile; }
    public void setDbFile(String dbFile) { this.dbFile = dbFile; }

    public String getPhotoFolder() { return photoFolder; }
    public void setPhotoFolder(String photoFolder) { this.photoFolder = photoFolder; }

    public String getSourceFolder() { return sourceFolder; }
    public void setSourceFolder(String sourceFolder) { this.sourceFolder = sourceFolder; }

    public String getTargetFolder() { return targetFolder; }
    public void setTargetFolder(String targetFolder) { this.targetFolder = targetFolder; }

    public int getMaxSize() { return maxSize; }
    public void setMaxSize(int maxSize) { this.maxSize = maxSize; }

    public int getZoomSize() { return zoomSize; }
    public void setZoomSize(int zoomSize) { this.zoomSize = zoomSize; }

    public String getCustomDateFormat() { return customDateFormat; }
    public void setCustomDateFormat(String customDateFormat) { this.customDateFormat = customDateFormat; }

    public Detection getDetection() { return detection; }
    public void setDetection(Detection detection) { this.detection = detection; }

    public Check getCheck() { return check; }
    public void setCheck(Check check) { this.check = check; }

    public Render getRender() { return render; }
    public void setRender(Render render) { this.render = render; }

    public Pre getPre() { return pre; }
    public void setPre(Pre pre) { this.pre = pre; }

    public static class Detection {
        private String cascadeFolder = "/usr/local/opt/opencv/share/OpenCV/haarcascades/";
        private boolean debug = false;

        public String getCascadeFolder() { return cascadeFolder; }
        public void setCascadeFolder(String cascadeFolder) { this.cascadeFolder = cascadeFolder; }

        public boolean isDebug() { return debug; }
        public void setDebug(boolean debug) { this.debug = debug; }
    }

    public static class Check {
        // Skip the whole-image view and go straight to the zoomed eyes
        private boolean detailOnly = true;

        public boolean isDetailOnly() { return detailOnly; }
        public void setDetailOnly(boolean detailOnly) { this.detailOnly = detailOnly; }
    }

    public static class Render {
        private RenderMode mode = RenderMode.FILL;
        private String fontPath;
        private int fontSize = 64;
        private String datePattern = "";
        private String locale = "de-DE";
        private double offsetX = 0.43;
        private double offsetY = 0.425;
        private int width = 1920;
        private int height = 1080;
        private boolean show = false;
        private boolean positionDebug = false;

        public RenderMode getMode() { return mode; }
        public void setMode(RenderMode mode) { this.mode = mode; }

        public String getFontPath() { return fontPath; }
        public void setFontPath(String fontPath) { this.fontPath = fontPath; }

        public int getFontSize() { return fontSize; }
        public void setFontSize(int fontSize) { this.fontSize = fontSize; }

        public String getDatePattern() { return datePattern; }
        public void setDatePattern(String datePattern) { this.datePattern = datePattern; }

        public String getLocale() { return locale; }
        public void setLocale(String locale) { this.locale = locale; }

        public double getOffsetX() { return offsetX; }
        public void setOffsetX(double offsetX) { this.offsetX = offsetX; }

        public double getOffsetY() { return offsetY; }
        public void setOffsetY(double offsetY) { this.offsetY = offsetY; }

        public int getWidth() { return width; }
        public void setWidth(int width) { this.width = width; }

        public int getHeight() { return height; }
        public void setHeight(int height) { this.height = height; }

        public boolean isShow() { return show; }
        public void setShow(boolean show) { this.show = show; }

        public boolean isPositionDebug() { return positionDebug; }
        public void setPositionDebug(boolean positionDebug) { this.positionDebug = positionDebug; }
    }

    public static class Pre {
        private String prefix = "elime";
        private boolean delete = false;

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }

        public boolean isDelete() { return delete; }
        public void setDelete(boolean delete) { this.delete = delete; }
    }
}
