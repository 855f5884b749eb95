package utilities;

public final class BenchmarkEnums {
    private BenchmarkEnums() {}

    public enum Metric {
        BUILD("build"),
        QUERY("query"),
        UPDATE("update");

        private final String csvLabel;

        Metric(String csvLabel) {
            this.csvLabel = csvLabel;
        }

        public String csvLabel() { return csvLabel; }
    }
}
