package com.zzf.workspace.core.tool;

public final class Toolkits {
    public static final String FILESYSTEM = "filesystem";
    public static final String SEARCH = "search";
    public static final String SANDBOX = "sandbox";

    private Toolkits() {
    }
}
