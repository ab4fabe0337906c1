package ai.importfix.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class ModuleKeyTest {

    @Test
    void fileKeysAreNormalized() {
        var a = ModuleKey.forFile(Path.of("/src/pkg/../pkg/mod.py"));
        var b = ModuleKey.forFile(Path.of("/src/pkg/mod.py"));
        assertEquals(a, b);
        assertEquals(ModuleSourceType.NORMAL, a.sourceType());
        assertTrue(a.isFileBacked());
        assertFalse(a.isNative());
        assertEquals(Path.of("/src/pkg/mod.py"), a.path());
    }

    @Test
    void basenames() {
        assertEquals("mod", ModuleKey.forFile(Path.of("/src/pkg/mod.py")).basename());
        assertEquals("pkg", ModuleKey.forFile(Path.of("/src/pkg/__init__.py")).basename());
        assertEquals("path", ModuleKey.builtin("os.path").basename());
        assertEquals("os", ModuleKey.builtin("os").basename());
        var compiled = new ModuleKey(ModuleSourceType.COMPILED, "/site/_speedups.cpython-311-darwin.so");
        assertEquals("_speedups", compiled.basename());
    }

    @Test
    void nativeAndBadKeys() {
        var builtin = ModuleKey.builtin("sys");
        assertTrue(builtin.isNative());
        assertTrue(builtin.isLoadable());
        assertFalse(builtin.isFileBacked());
        assertThrows(IllegalStateException.class, builtin::path);

        var bad = ModuleKey.bad("nope");
        assertFalse(bad.isLoadable());
        assertEquals("BAD:nope", bad.toString());
    }

    @Test
    void orderIsBySourceTypeThenId() {
        var a = ModuleKey.forFile(Path.of("/a.py"));
        var b = ModuleKey.forFile(Path.of("/b.py"));
        var zlib = ModuleKey.builtin("zlib");
        var keys = new ArrayList<>(List.of(b, zlib, a));
        Collections.sort(keys);
        assertEquals(List.of(zlib, a, b), keys);
    }
}
