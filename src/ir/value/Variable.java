package ir.value;

import ir.type.Type;
import ir.type.UnknownType;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * A recovered storage location: a register, a stack slot or a global.
 */
public class Variable {
    private final int id;
    private final String name;
    private final StorageClass storage;
    // register name for REGISTER, null otherwise
    private final String register;
    // frame offset relative to the entry stack pointer, or absolute address for GLOBAL
    private final long location;
    private int width;
    private Type type = UnknownType.get();
    private final Set<Integer> liveBlocks = new TreeSet<>();

    public Variable(int id, String name, StorageClass storage, String register, long location, int width) {
        this.id = id;
        this.name = name;
        this.storage = storage;
        this.register = register;
        this.location = location;
        this.width = width;
    }

    public Variable copy() {
        Variable v = new Variable(id, name, storage, register, location, width);
        v.type = type;
        v.liveBlocks.addAll(liveBlocks);
        return v;
    }

    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public StorageClass getStorage() {
        return storage;
    }

    public boolean isRegister() {
        return storage == StorageClass.REGISTER;
    }

    public boolean isParameter() {
        return storage == StorageClass.PARAMETER;
    }

    public String getRegister() {
        return register;
    }

    public long getLocation() {
        return location;
    }

    /**
     * @return access width in bytes
     */
    public int getWidth() {
        return width;
    }

    public void setWidth(int width) {
        this.width = width;
    }

    public Type getType() {
        return type;
    }

    public void setType(Type type) {
        this.type = type;
    }

    /**
     * @return ids of the blocks this variable is live in, ascending
     */
    public Set<Integer> getLiveBlocks() {
        return Collections.unmodifiableSet(liveBlocks);
    }

    public void setLiveBlocks(Set<Integer> blocks) {
        liveBlocks.clear();
        liveBlocks.addAll(blocks);
    }

    @Override
    public String toString() {
        return name;
    }
}
