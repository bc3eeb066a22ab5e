package io.hyperloglog.sketch;

import com.google.common.base.Preconditions;
import com.google.common.hash.HashFunction;
import com.google.common.primitives.Longs;

import java.security.MessageDigest;

/**
 * Turns arbitrary bytes into 64-bits hash values suitable for {@link HyperLogLog#add(long)}.
 *
 * <p>The first 8 bytes of the digest are read as a little-endian unsigned integer.
 */
public final class Hashes
{
  private Hashes()
  {
  }

  /**
   * @throws IllegalStateException if the function produces less than 64 bits
   */
  public static long hash64(HashFunction hashFunction, byte[] data)
  {
    // HashCode#asLong reads the first 8 bytes in little-endian order
    return hashFunction.hashBytes(data).asLong();
  }

  /**
   * Resets {@code digest} before use.
   *
   * @throws IllegalStateException if the digest is shorter than 8 bytes
   */
  public static long hash64(MessageDigest digest, byte[] data)
  {
    digest.reset();
    final byte[] result = digest.digest(data);
    Preconditions.checkState(
        result.length >= Long.BYTES,
        "digest %s is too short [%s bytes] : needs at least %s bytes",
        digest.getAlgorithm(),
        result.length,
        Long.BYTES
    );
    return Longs.fromBytes(result[7], result[6], result[5], result[4], result[3], result[2], result[1], result[0]);
  }
}
