package com.satfetch.models;

public interface DownloadItem {

    String itemId();

    String uri();

    default String fileName() {
        String path = uri();
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        int slash = path.lastIndexOf('/');
        String name = slash >= 0 ? path.substring(slash + 1) : path;
        return isPlainFileName(name) ? name : itemId();
    }

    // rejects names that would resolve outside the destination directory
    static boolean isPlainFileName(String name) {
        return name != null && !name.isBlank() && !name.equals(".") && !name.equals("..")
                && name.indexOf('\\') < 0;
    }
}
