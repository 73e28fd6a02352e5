package com.tfstage.volume;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class VolumePathsTest {

    @Test
    @DisplayName("卷 ID 映射为 pairtree 相对路径")
    void mapsIdentifierToPairtreePath() {
        assertEquals("mdp/pairtree_root/39/01/50/12/34/56/78/39015012345678/mdp.39015012345678.json.gz",
            VolumePaths.toRelativePath("mdp.39015012345678", ".json.gz"));
    }

    @Test
    @DisplayName("本地 ID 中的特殊字符被清洗")
    void cleansSpecialCharacters() {
        String relative = VolumePaths.toRelativePath("uc2.ark:/13960/t0", ".json");
        assertEquals("uc2/pairtree_root/ar/k+/=1/39/60/=t/0/ark+=13960=t0/uc2.ark+=13960=t0.json", relative);
    }

    @ParameterizedTest
    @ValueSource(strings = {"mdp.39015012345678", "uc2.ark:/13960/t0", "hvd.hn1a2b", "nyp.334.33"})
    void pathAndIdentifierAreInverse(String volumeId) {
        String relative = VolumePaths.toRelativePath(volumeId, ".json.gz");
        assertEquals(volumeId, VolumePaths.idFromPath(relative, ".json.gz"));
    }

    @Test
    void resolvesUnderDataDirectory() {
        VolumePaths paths = new VolumePaths(Path.of("/data"), ".json");
        assertEquals(Path.of("/data/hvd/pairtree_root/hn/1a/2b/hn1a2b/hvd.hn1a2b.json"), paths.resolve("hvd.hn1a2b"));
    }

    @Test
    void rejectsIdentifierWithoutPrefix() {
        assertThrows(IllegalArgumentException.class, () -> VolumePaths.toRelativePath("noprefix", ".json"));
        assertThrows(IllegalArgumentException.class, () -> VolumePaths.idFromPath("a/b/.json", ".json"));
        assertThrows(IllegalArgumentException.class, () -> VolumePaths.idFromPath("  ", ".json"));
    }
}
