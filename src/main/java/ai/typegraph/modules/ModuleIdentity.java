package ai.typegraph.modules;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.jar.Attributes;
import java.util.jar.JarFile;
import java.util.jar.Manifest;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.zip.ZipEntry;

import org.objectweb.asm.ClassReader;
import org.objectweb.asm.ClassVisitor;
import org.objectweb.asm.ModuleVisitor;
import org.objectweb.asm.Opcodes;

/**
 * Name and version of a JAR or class directory.
 * Lookup order: module-info, then the manifest, then a {@code name-version.jar}
 * file name, then the bare file or directory name with version {@value #DEFAULT_VERSION}.
 */
public record ModuleIdentity(String name, String version) {

    public static final String DEFAULT_VERSION = "0.0.0";

    // e.g. guava-33.0.0-jre.jar, commons-lang3-3.14.0.jar
    private static final Pattern VERSIONED_JAR = Pattern.compile("^(.+?)-(\\d+(?:\\.\\d+)*(?:[-.][A-Za-z0-9.-]+)?)\\.jar$");

    private static final String MODULE_INFO = "module-info.class";
    private static final String MANIFEST = "META-INF/MANIFEST.MF";

    public ModuleIdentity {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(version, "version");
    }

    public static ModuleIdentity of(Path location) throws IOException {
        return resolve(location, null, null);
    }

    /**
     * @param nameOverride    used instead of any discovered name when non-blank
     * @param versionOverride used instead of any discovered version when non-blank
     */
    public static ModuleIdentity resolve(Path location, String nameOverride, String versionOverride) throws IOException {
        Objects.requireNonNull(location, "location");
        final ModuleIdentity discovered = discover(location);
        final String name = isBlank(nameOverride) ? discovered.name() : nameOverride;
        final String version = isBlank(versionOverride) ? discovered.version() : versionOverride;
        return new ModuleIdentity(name, version);
    }

    private static ModuleIdentity discover(Path location) throws IOException {
        String name = null;
        String version = null;

        final byte[] moduleInfo;
        final Manifest manifest;
        if (Files.isDirectory(location)) {
            final Path info = location.resolve(MODULE_INFO);
            moduleInfo = Files.isRegularFile(info) ? Files.readAllBytes(info) : null;
            final Path mf = location.resolve(MANIFEST);
            if (Files.isRegularFile(mf)) {
                try (InputStream in = Files.newInputStream(mf)) {
                    manifest = new Manifest(in);
                }
            } else {
                manifest = null;
            }
        } else {
            try (JarFile jar = new JarFile(location.toFile())) {
                final ZipEntry info = jar.getEntry(MODULE_INFO);
                if (info != null) {
                    try (InputStream in = jar.getInputStream(info)) {
                        moduleInfo = in.readAllBytes();
                    }
                } else {
                    moduleInfo = null;
                }
                manifest = jar.getManifest();
            }
        }

        if (moduleInfo != null) {
            final String[] declared = readModuleDeclaration(moduleInfo);
            name = declared[0];
            version = declared[1];
        }

        if (manifest != null) {
            final Attributes main = manifest.getMainAttributes();
            if (name == null) {
                name = firstNonBlank(main.getValue("Automatic-Module-Name"), main.getValue("Implementation-Title"));
            }
            if (version == null) {
                version = firstNonBlank(main.getValue("Implementation-Version"), main.getValue("Bundle-Version"));
            }
        }

        final String fileName = location.getFileName() == null ? location.toString() : location.getFileName().toString();
        final Matcher m = VERSIONED_JAR.matcher(fileName);
        if (m.matches()) {
            if (name == null) {
                name = m.group(1);
            }
            if (version == null) {
                version = m.group(2);
            }
        }

        if (name == null) {
            name = fileName.endsWith(".jar") ? fileName.substring(0, fileName.length() - 4) : fileName;
        }
        if (version == null) {
            version = DEFAULT_VERSION;
        }
        return new ModuleIdentity(name, version);
    }

    /**
     * @return {name, version}, either may be {@code null}
     */
    static String[] readModuleDeclaration(byte[] moduleInfo) {
        final String[] out = new String[2];
        new ClassReader(moduleInfo).accept(new ClassVisitor(Opcodes.ASM9) {
            @Override
            public ModuleVisitor visitModule(String moduleName, int access, String moduleVersion) {
                out[0] = moduleName;
                out[1] = moduleVersion;
                return null;
            }
        }, ClassReader.SKIP_CODE | ClassReader.SKIP_DEBUG | ClassReader.SKIP_FRAMES);
        return out;
    }

    private static String firstNonBlank(String a, String b) {
        if (!isBlank(a)) {
            return a.trim();
        }
        return isBlank(b) ? null : b.trim();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
