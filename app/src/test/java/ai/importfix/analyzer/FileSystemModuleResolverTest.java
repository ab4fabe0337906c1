package ai.importfix.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import ai.importfix.testutil.InlinePythonProject;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSystemModuleResolverTest {

    @TempDir
    Path root;

    @TempDir
    Path sitePackages;

    private InlinePythonProject project;
    private FileSystemModuleResolver resolver;

    @BeforeEach
    void setUp() {
        project = new InlinePythonProject(root);
        project.write("app/__init__.py", "");
        project.write("app/main.py", "");
        project.write("app/util/__init__.py", "");
        project.write("app/util/text.py", "");
        resolver = new FileSystemModuleResolver(List.of(root, sitePackages));
    }

    @Test
    void absoluteImportsPreferTheImportingDirectory() {
        project.write("app/helpers.py", "");
        project.write("helpers.py", "");
        var key = resolver.resolve("helpers", root.resolve("app"));
        assertEquals(ModuleKey.forFile(root.resolve("app/helpers.py")), key);
    }

    @Test
    void packagesResolveToTheirInit() {
        assertEquals(ModuleKey.forFile(root.resolve("app/util/__init__.py")), resolver.resolve("app.util", root));
        assertEquals(ModuleKey.forFile(root.resolve("app/util/text.py")), resolver.resolve("app.util.text", root));
    }

    @Test
    void relativeImportsClimbOneDirectoryPerExtraDot() {
        var fromUtil = root.resolve("app/util");
        assertEquals(ModuleKey.forFile(root.resolve("app/util/text.py")), resolver.resolve(".text", fromUtil));
        assertEquals(ModuleKey.forFile(root.resolve("app/main.py")), resolver.resolve("..main", fromUtil));
        assertEquals(ModuleKey.forFile(root.resolve("app/util/__init__.py")), resolver.resolve(".", fromUtil));
        assertEquals(ModuleSourceType.BAD, resolver.resolve(".missing", fromUtil).sourceType());
    }

    @Test
    void searchPathsAreConsulted() throws Exception {
        Files.writeString(sitePackages.resolve("thirdparty.py"), "");
        assertEquals(ModuleKey.forFile(sitePackages.resolve("thirdparty.py")), resolver.resolve("thirdparty", root));
    }

    @Test
    void compiledExtensionsAreNative() throws Exception {
        Files.writeString(sitePackages.resolve("fast.cpython-311-x86_64-linux-gnu.so"), "");
        var key = resolver.resolve("fast", root);
        assertEquals(ModuleSourceType.COMPILED, key.sourceType());
        assertTrue(key.isNative());
        assertEquals("fast", key.basename());
    }

    @Test
    void standardLibraryIsBuiltin() {
        assertEquals(ModuleKey.builtin("os.path"), resolver.resolve("os.path", root));
        assertEquals(ModuleSourceType.BAD, resolver.resolve("no_such_module", root).sourceType());
    }

    @Test
    void localModulesShadowTheStandardLibrary() {
        project.write("json.py", "");
        assertEquals(ModuleKey.forFile(root.resolve("json.py")), resolver.resolve("json", root));
    }

    @Test
    void moduleNamesFollowEnclosingPackages() {
        var text = ModuleKey.forFile(root.resolve("app/util/text.py"));
        assertEquals(Optional.of("app.util.text"), resolver.moduleNameFor(text));
        var util = ModuleKey.forFile(root.resolve("app/util/__init__.py"));
        assertEquals(Optional.of("app.util"), resolver.moduleNameFor(util));
        assertEquals(Optional.of("os.path"), resolver.moduleNameFor(ModuleKey.builtin("os.path")));
    }

    @Test
    void onlySourceModulesHaveSource() throws Exception {
        project.write("src_mod.py", "X = 1\n");
        assertEquals("X = 1\n", resolver.readSource(ModuleKey.forFile(root.resolve("src_mod.py"))));
        assertThrows(IOException.class, () -> resolver.readSource(ModuleKey.builtin("os")));
    }
}
