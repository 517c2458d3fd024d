package io.pqcscan.audit;

import io.pqcscan.model.Language;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups the inputs of one batch call by content hash and language.
 * <p>
 * Inputs with identical content and language are parsed once and the
 * result is reused for every member of the group. An arena lives for a
 * single {@code auditMany} call and is discarded with it.
 */
final class ParsedFileArena {

    /**
     * Reuse key: identical content hash and language means an identical parse.
     */
    record Key(String contentHash, Language language) {
    }

    /**
     * A batch input together with its position in the caller's list.
     */
    record Member(int index, SourceFile file) {
    }

    /**
     * All inputs sharing one key. The first member's content is parsed.
     */
    record Group(Key key, List<Member> members) {

        String content() {
            return members.get(0).file().content();
        }
    }

    private final Map<Key, List<Member>> groups = new LinkedHashMap<>();

    void add(int index, SourceFile file, Language language) {
        Key key = new Key(sha256(file.content()), language);
        groups.computeIfAbsent(key, k -> new ArrayList<>()).add(new Member(index, file));
    }

    Collection<Group> groups() {
        List<Group> result = new ArrayList<>(groups.size());
        groups.forEach((key, members) -> result.add(new Group(key, List.copyOf(members))));
        return result;
    }

    int size() {
        return groups.size();
    }

    private static String sha256(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
