package init;

public class Config {

    // Basic Config
    public static String logLevel = "OFF";

    // SMT Config
    public static int smtTimeout = 5; // seconds, 0 or less disables the budget

    // Path Config
    public static String resultPath = "smt-results/result.jsonl";
}
