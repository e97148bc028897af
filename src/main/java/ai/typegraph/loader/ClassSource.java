package ai.typegraph.loader;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * A place class files are read from: a class directory, a JAR or the JDK runtime image.
 */
interface ClassSource extends Closeable {

    /**
     * @param internalName e.g. {@code java/util/Map$Entry}
     * @return the class file and the module it belongs to, or {@code null} when absent
     */
    Found find(String internalName) throws IOException;

    /**
     * Internal names of every class file, sorted; {@code module-info} and
     * {@code package-info} excluded.
     */
    List<String> classNames() throws IOException;

    record Found(byte[] bytes, AsmModule module) {
    }
}
