package net.layerline.core.model;

public enum JobType {
    SLICING("Slicing"),
    MODEL_GENERATION("3D model generation"),
    GCODE_ANALYSIS("G-code analysis");

    private final String label;

    JobType(String label) { this.label = label; }

    /** 알림 문구용 */
    public String label() { return label; }

    public static JobType from(String s) {
        if (s == null) throw new IllegalArgumentException("job type is null");
        return JobType.valueOf(s.trim().toUpperCase());
    }

    public String code() { return name().toLowerCase(); }
}
