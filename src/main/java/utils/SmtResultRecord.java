package utils;

/**
 * One exported line: the outcome of a single SMT snippet comparison.
 */
public class SmtResultRecord {

    private int code;
    private String outcome;
    private String leftBlock;
    private String rightBlock;
    private int startL;
    private int startR;
    private int endL;
    private int endR;
    private long elapsedMillis;
    private String message;

    public SmtResultRecord() {
    }

    public SmtResultRecord(int code, String leftBlock, String rightBlock, int startL, int startR) {
        this.code = code;
        this.outcome = ResultExporter.describe(code);
        this.leftBlock = leftBlock;
        this.rightBlock = rightBlock;
        this.startL = startL;
        this.startR = startR;
    }

    public int getCode() {
        return code;
    }

    public void setCode(int code) {
        this.code = code;
    }

    public String getOutcome() {
        return outcome;
    }

    public void setOutcome(String outcome) {
        this.outcome = outcome;
    }

    public String getLeftBlock() {
        return leftBlock;
    }

    public void setLeftBlock(String leftBlock) {
        this.leftBlock = leftBlock;
    }

    public String getRightBlock() {
        return rightBlock;
    }

    public void setRightBlock(String rightBlock) {
        this.rightBlock = rightBlock;
    }

    public int getStartL() {
        return startL;
    }

    public void setStartL(int startL) {
        this.startL = startL;
    }

    public int getStartR() {
        return startR;
    }

    public void setStartR(int startR) {
        this.startR = startR;
    }

    public int getEndL() {
        return endL;
    }

    public void setEndL(int endL) {
        this.endL = endL;
    }

    public int getEndR() {
        return endR;
    }

    public void setEndR(int endR) {
        this.endR = endR;
    }

    public long getElapsedMillis() {
        return elapsedMillis;
    }

    public void setElapsedMillis(long elapsedMillis) {
        this.elapsedMillis = elapsedMillis;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }
}
