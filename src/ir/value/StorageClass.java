package ir.value;

public enum StorageClass {
    REGISTER,
    // frame slot below the return address
    STACK,
    // frame slot above the return address
    PARAMETER,
    GLOBAL
}
