package ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class BasicBlock {

    private final String name;
    private final List<Instruction> instructions = new ArrayList<>();

    public BasicBlock(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public void append(Instruction inst) {
        if (!instructions.isEmpty() && instructions.get(instructions.size() - 1).isTerminator()) {
            throw new IllegalStateException("Block " + name + " is already terminated");
        }
        inst.setParent(this);
        instructions.add(inst);
    }

    public Instruction get(int index) {
        return instructions.get(index);
    }

    public int size() {
        return instructions.size();
    }

    public int indexOf(Instruction inst) {
        for (int i = 0; i < instructions.size(); i++) {
            if (instructions.get(i) == inst) {
                return i;
            }
        }
        return -1;
    }

    public List<Instruction> getInstructions() {
        return Collections.unmodifiableList(instructions);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name).append(":\n");
        for (Instruction inst : instructions) {
            sb.append("  ").append(inst).append('\n');
        }
        return sb.toString();
    }
}
