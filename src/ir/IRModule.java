package ir;

import exception.MalformedInputException;
import ir.value.Function;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Whole decompilation unit: functions in the order their entries were first
 * seen, plus the shared type table.
 */
public class IRModule {
    private final String name;
    private final Map<String, Function> functions = new LinkedHashMap<>();
    private final TypeTable typeTable;

    public IRModule(String name) {
        this(name, new TypeTable());
    }

    private IRModule(String name, TypeTable typeTable) {
        this.name = name;
        this.typeTable = typeTable;
    }

    /**
     * Deep copy: functions, blocks, instructions and variables are all fresh objects.
     */
    public IRModule copy() {
        IRModule m = new IRModule(name, typeTable.copy());
        for (Function f : functions.values()) {
            m.functions.put(f.getName(), f.copy());
        }
        return m;
    }

    public String getName() {
        return name;
    }

    public void addFunction(Function function) {
        if (functions.containsKey(function.getName())) {
            throw MalformedInputException.duplicateFunction(function.getName(), function.getEntryAddress());
        }
        functions.put(function.getName(), function);
    }

    public List<Function> getFunctions() {
        return Collections.unmodifiableList(new ArrayList<>(functions.values()));
    }

    public Function getFunction(String name) {
        return functions.get(name);
    }

    public Function getFunctionAt(long entryAddress) {
        for (Function f : functions.values()) {
            if (f.getEntryAddress() == entryAddress) {
                return f;
            }
        }
        return null;
    }

    public TypeTable getTypeTable() {
        return typeTable;
    }

    /**
     * @return warnings of all functions, in module order
     */
    public List<Diagnostic> getDiagnostics() {
        List<Diagnostic> all = new ArrayList<>();
        for (Function f : functions.values()) {
            all.addAll(f.getDiagnostics());
        }
        return all;
    }

    @Override
    public String toString() {
        return new IRPrinter().print(this);
    }
}
