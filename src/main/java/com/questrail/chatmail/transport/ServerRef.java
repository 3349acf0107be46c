package com.questrail.chatmail.transport;

import java.util.Objects;

/**
 * Location of a message copy on the mail server.
 *
 * @param folder server folder name
 * @param uid    uid within the folder, positive
 */
public record ServerRef(String folder, long uid) {

    public ServerRef {
        Objects.requireNonNull(folder, "folder");
        if (folder.isBlank()) {
            throw new IllegalArgumentException("folder must not be blank");
        }
        if (uid <= 0) {
            throw new IllegalArgumentException("uid must be positive: " + uid);
        }
    }

    public ServerRef withUid(long newUid) {
        return new ServerRef(folder, newUid);
    }

    public ServerRef inFolder(String newFolder, long newUid) {
        return new ServerRef(newFolder, newUid);
    }
}
