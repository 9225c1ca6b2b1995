package edu.tum.cs.topicsweep.util.io;

import java.io.File;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.concurrent.Callable;
import java.util.logging.Logger;

import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

/**
 * Stores derived artifacts under a directory, keyed on a fingerprint of the inputs they were computed from. An
 * artifact is only computed if no artifact with the same key exists; completed artifacts are moved into place in a
 * single step, so an interrupted run never leaves a partial file under the final name.
 */
public class ArtifactCache {

	private static final Logger logger = Logger.getLogger(ArtifactCache.class.getName());

	public interface Codec<T> {
		public void save(T artifact, File f) throws IOException;
		public T load(File f) throws IOException;
	}

	private final File cacheDir;

	public ArtifactCache(File cacheDir) {
		this.cacheDir = cacheDir;
	}

	/** @return a key covering the contents of the given files and the given additional parts */
	public static String fingerprint(File[] inputs, String... parts) throws IOException {
		Hasher hasher = Hashing.sha256().newHasher();
		for (File f : inputs)
			hasher.putBytes(com.google.common.io.Files.asByteSource(f).hash(Hashing.sha256()).asBytes());
		for (String part : parts)
			hasher.putUnencodedChars(part).putChar('\0');
		return hasher.hash().toString();
	}

	public File getFile(String name, String key, String extension) {
		return new File(cacheDir, name + "-" + key.substring(0, Math.min(16, key.length())) + extension);
	}

	public boolean contains(String name, String key, String extension) {
		return getFile(name, key, extension).isFile();
	}

	public <T> T computeOrLoad(String name, String key, String extension, Codec<T> codec, Callable<T> producer)
			throws Exception {
		File f = getFile(name, key, extension);
		if (f.isFile()) {
			logger.info("Loading cached " + name + " from " + f);
			return codec.load(f);
		}

		T artifact = producer.call();
		if (!cacheDir.isDirectory() && !cacheDir.mkdirs())
			throw new IOException("cannot create cache directory '" + cacheDir.getPath() + "'");
		File tmp = File.createTempFile(name + "-", ".tmp", cacheDir);
		try {
			codec.save(artifact, tmp);
			try {
				Files.move(tmp.toPath(), f.toPath(), StandardCopyOption.ATOMIC_MOVE);
			} catch (AtomicMoveNotSupportedException ex) {
				Files.move(tmp.toPath(), f.toPath(), StandardCopyOption.REPLACE_EXISTING);
			}
		} finally {
			Files.deleteIfExists(tmp.toPath());
		}
		logger.info("Cached " + name + " as " + f);
		return artifact;
	}

}
