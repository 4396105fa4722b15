package utils;

import com.alibaba.fastjson2.JSON;
import solver.SmtComparisonException;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Appends one JSON line per SMT snippet comparison so that the outer tool can
 * tell proven equalities, structural mismatches, unsupported constructs and
 * solver timeouts apart.
 */
public class ResultExporter implements Closeable {
    public static final int CODE_EQUAL = 0;
    public static final int CODE_NOT_EQUAL = 1;
    public static final int CODE_NO_SYNC = 2;
    public static final int CODE_UNSUPPORTED = 3;
    public static final int CODE_TIMEOUT = 4;

    private final File outputFile;
    private final BufferedWriter bufferedWriter;
    private final ReentrantLock writeLock = new ReentrantLock();
    private int written;
    private volatile boolean shutdown = false;

    public ResultExporter(String outputPath) {
        this.outputFile = initOutputFile(outputPath);
        this.bufferedWriter = initBufferedWriter(this.outputFile);
    }

    private File initOutputFile(String outputPath) {
        File file = new File(outputPath);
        File parentDir = file.getParentFile();

        if (parentDir != null && !parentDir.exists()) {
            if (!parentDir.mkdirs()) {
                Log.error("Failed to create directory: " + parentDir.getAbsolutePath());
                throw new RuntimeException("Directory creation failed: " + parentDir.getAbsolutePath());
            }
        }
        return file;
    }

    private BufferedWriter initBufferedWriter(File file) {
        try {
            return new BufferedWriter(new FileWriter(file, true));
        } catch (IOException e) {
            Log.error("Failed to initialize BufferedWriter for file: " + file.getAbsolutePath() + " " + e);
            throw new RuntimeException("BufferedWriter initialization failed", e);
        }
    }

    public static int codeOf(SmtComparisonException e) {
        switch (e.getCategory()) {
            case STRUCTURAL_MISMATCH:
                return CODE_NO_SYNC;
            case SOLVER_TIMEOUT:
                return CODE_TIMEOUT;
            default:
                return CODE_UNSUPPORTED;
        }
    }

    public static String describe(int code) {
        switch (code) {
            case CODE_EQUAL:
                return "equal";
            case CODE_NOT_EQUAL:
                return "not-equal";
            case CODE_NO_SYNC:
                return "no-synchronization-point";
            case CODE_UNSUPPORTED:
                return "unsupported";
            case CODE_TIMEOUT:
                return "timeout";
            default:
                return "unknown";
        }
    }

    public void writeResult(SmtResultRecord record) {
        writeString(JSON.toJSONString(record));
    }

    public void writeString(String content) {
        if (shutdown) {
            return;
        }
        writeLock.lock();
        try {
            bufferedWriter.write(content);
            bufferedWriter.write(System.lineSeparator());
            bufferedWriter.flush();
            written++;
        } catch (IOException e) {
            Log.errorStack("Failed to write result to " + outputFile.getAbsolutePath(), e);
            throw new RuntimeException("Result export failed", e);
        } finally {
            writeLock.unlock();
        }
    }

    public int getWritten() {
        return written;
    }

    public File getOutputFile() {
        return outputFile;
    }

    @Override
    public void close() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        writeLock.lock();
        try {
            bufferedWriter.close();
        } catch (IOException e) {
            Log.error("Failed to close result file: " + e.getMessage());
        } finally {
            writeLock.unlock();
        }
    }
}
