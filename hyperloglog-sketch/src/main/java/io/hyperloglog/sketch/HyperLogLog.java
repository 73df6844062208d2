package io.hyperloglog.sketch;

import com.google.common.base.Preconditions;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import com.google.common.io.ByteStreams;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Implements HyperLogLog described in http://algo.inria.fr/flajolet/Publications/FlFuGaMe07.pdf.
 *
 * <p>Uses a 32-bits hash function with a parameter p (the precision). The top p bits of the hash select
 * the register, the position of the first 1-bit in the remaining (32 - p) bits is the rank.
 *
 * <p>Besides the raw registers, a second "protected" array can be produced by {@link #protect(int)}: a copy
 * of the registers where a single register far below all the others is lifted to the second lowest value.
 * Each register takes 8-bits.
 *
 * <p>Instances are not thread-safe.
 */
public class HyperLogLog implements CardinalityEstimator<HyperLogLog>
{
  public static final int MIN_PRECISION = 4;
  public static final int MAX_PRECISION = 30;
  public static final int DEFAULT_PRECISION = 4;
  public static final int HASH_SEED = 313;

  private static final HashFunction DEFAULT_HASH_FUNCTION = Hashing.murmur3_32_fixed(HASH_SEED);

  private static final double TWO_TO_THE_THIRTY_TWO = Math.pow(2, 32);
  private static final double HIGH_CORRECTION_THRESHOLD = TWO_TO_THE_THIRTY_TWO / 30.0d;

  private final HashFunction hashFunction;

  private int p;
  private int m;
  private double alphaMM;

  private byte[] registers;
  // allocated on first protect(), dropped on restore
  private byte[] protectedRegisters;

  public static HyperLogLog create()
  {
    return create(DEFAULT_PRECISION);
  }

  public static HyperLogLog create(int precision)
  {
    return new HyperLogLog(precision, DEFAULT_HASH_FUNCTION);
  }

  /**
   * @param hashFunction must produce at least 32 bits, only the first 32 bits are used
   */
  public HyperLogLog(int precision, HashFunction hashFunction)
  {
    checkPrecision(precision);
    Preconditions.checkArgument(hashFunction.bits() >= Integer.SIZE, "hash function %s is narrower than 32 bits", hashFunction);
    this.hashFunction = hashFunction;
    this.p = precision;
    this.m = 1 << precision;
    this.alphaMM = alphaMM(m);
    this.registers = new byte[m];
  }

  private static void checkPrecision(int precision)
  {
    Preconditions.checkArgument(
        precision >= MIN_PRECISION && precision <= MAX_PRECISION,
        "invalid precision [%s] : should be in [%s, %s]",
        precision,
        MIN_PRECISION,
        MAX_PRECISION
    );
  }

  static double alphaMM(int m)
  {
    final double alpha;
    switch (m) {
      case 16:
        alpha = 0.673;
        break;
      case 32:
        alpha = 0.697;
        break;
      case 64:
        alpha = 0.709;
        break;
      default:
        alpha = 0.7213 / (1.0 + 1.079 / m);
    }
    return alpha * m * m;
  }

  @Override
  public void add(byte[] value)
  {
    add(value, 0, value.length);
  }

  public void add(byte[] value, int offset, int length)
  {
    addHash(hashFunction.hashBytes(value, offset, length).asInt());
  }

  public void add(CharSequence value)
  {
    add(value.toString().getBytes(StandardCharsets.UTF_8));
  }

  @Override
  public void add(long value)
  {
    addHash(hashFunction.hashLong(value).asInt());
  }

  void addHash(int hash)
  {
    final int index = hash >>> (Integer.SIZE - p);
    final int rank = rank(hash << p, Integer.SIZE - p);
    if (Byte.toUnsignedInt(registers[index]) < rank) {
      registers[index] = (byte) rank;
    }
  }

  /**
   * Position of the first 1-bit of {@code bits}, counted from the most significant bit and starting at 1.
   * Only the first {@code window} bits are looked at, so the result is at most {@code window + 1}.
   */
  static int rank(int bits, int window)
  {
    return Math.min(Integer.numberOfLeadingZeros(bits), window) + 1;
  }

  public int precision()
  {
    return p;
  }

  public int registerCount()
  {
    return m;
  }

  public int counter(int index)
  {
    Preconditions.checkElementIndex(index, m);
    return Byte.toUnsignedInt(registers[index]);
  }

  public int protectedCounter(int index)
  {
    Preconditions.checkElementIndex(index, m);
    return protectedRegisters == null ? 0 : Byte.toUnsignedInt(protectedRegisters[index]);
  }

  /**
   * Toggles bit {@code bit} of register {@code index}. Only meant for fault injection.
   * Bits outside the 8-bit register are a no-op.
   */
  public void flipBit(int index, int bit)
  {
    Preconditions.checkElementIndex(index, m);
    if (bit >= 0 && bit < Byte.SIZE) {
      registers[index] ^= (byte) (1 << bit);
    }
  }

  @Override
  public void clear()
  {
    Arrays.fill(registers, (byte) 0);
  }

  /**
   * @param protect whether to estimate from the array produced by the last {@link #protect(int)}
   *                instead of the live registers. Before any protect() the protected array is all zeros.
   */
  public double estimate(boolean protect)
  {
    if (protect) {
      return protectedRegisters == null ? 0.0d : estimate(protectedRegisters);
    }
    return estimate(registers);
  }

  private double estimate(byte[] record)
  {
    double registerSum = 0.0;
    int zeros = 0;
    for (int i = 0; i < m; i++) {
      final int r = Byte.toUnsignedInt(record[i]);
      registerSum += Math.scalb(1.0d, -r);
      if (r == 0) {
        zeros++;
      }
    }
    return makeCorrection(alphaMM / registerSum, zeros, m);
  }

  static double makeCorrection(double e, int zeros, int m)
  {
    if (e <= (2.5d * m)) { // small range correction
      return zeros == 0 ? e : m * Math.log(m / (double) zeros);
    }

    if (e > HIGH_CORRECTION_THRESHOLD) { // high range correction
      return -TWO_TO_THE_THIRTY_TWO * Math.log(1 - e / TWO_TO_THE_THIRTY_TWO);
    }

    return e;
  }

  @Override
  public double estimate()
  {
    return estimate(false);
  }

  /**
   * Refreshes the protected registers from the live ones. If the lowest register is at least
   * {@code threshold} below the second lowest, the protected copy takes the second lowest value there.
   * Ties keep the first index seen.
   */
  public void protect(int threshold)
  {
    Preconditions.checkArgument(threshold >= 0, "threshold [%s] must not be negative", threshold);
    if (protectedRegisters == null || protectedRegisters.length != m) {
      protectedRegisters = new byte[m];
    }
    System.arraycopy(registers, 0, protectedRegisters, 0, m);

    int min1 = Integer.MAX_VALUE;
    int min2 = Integer.MAX_VALUE;
    int minPos1 = 0;
    int minPos2 = 0;
    for (int i = 0; i < m; i++) {
      final int r = Byte.toUnsignedInt(protectedRegisters[i]);
      if (r < min1) {
        min2 = min1;
        minPos2 = minPos1;
        min1 = r;
        minPos1 = i;
      } else if (r < min2) {
        min2 = r;
        minPos2 = i;
      }
    }

    if (min2 - min1 >= threshold) {
      protectedRegisters[minPos1] = protectedRegisters[minPos2];
    }
  }

  /**
   * Folds {@code that} into this estimator so it estimates the union of both. {@code that} is not modified.
   *
   * @throws RegisterCountMismatchException if the register counts differ, nothing is modified then
   */
  @Override
  public void merge(HyperLogLog that)
  {
    if (this.m != that.m) {
      throw new RegisterCountMismatchException(this.m, that.m);
    }
    for (int i = 0; i < m; i++) {
      if (Byte.toUnsignedInt(registers[i]) < Byte.toUnsignedInt(that.registers[i])) {
        registers[i] = that.registers[i];
      }
    }
  }

  /**
   * Writes the precision (1 byte) followed by one byte per register.
   */
  public void dump(OutputStream out) throws IOException
  {
    out.write(p);
    out.write(registers);
  }

  /**
   * Replaces the whole state with what {@link #dump(OutputStream)} wrote. The state is swapped in only after
   * the full read succeeded, any failure leaves this estimator untouched. The protected registers are cleared.
   */
  public void restore(InputStream in) throws IOException
  {
    final int precision = in.read();
    if (precision < 0) {
      throw new EOFException("missing precision byte");
    }
    final HyperLogLog restored;
    try {
      restored = new HyperLogLog(precision, hashFunction);
    }
    catch (IllegalArgumentException e) {
      throw new IOException("corrupted estimator state", e);
    }
    ByteStreams.readFully(in, restored.registers);
    swap(restored);
    this.protectedRegisters = null;
  }

  private void swap(HyperLogLog that)
  {
    this.p = that.p;
    this.m = that.m;
    this.alphaMM = that.alphaMM;
    this.registers = that.registers;
  }

  public byte[] toByteArray()
  {
    final ByteArrayOutputStream out = new ByteArrayOutputStream(1 + m);
    try {
      dump(out);
    }
    catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return out.toByteArray();
  }

  public static HyperLogLog fromByteArray(byte[] bytes) throws IOException
  {
    final HyperLogLog hll = create(MIN_PRECISION);
    hll.restore(new ByteArrayInputStream(bytes));
    return hll;
  }

  @Override
  public long memoryFootprint()
  {
    return registers.length; // not counting the protected copy
  }

  @Override
  public String name()
  {
    return "hll" + p;
  }

  @Override
  public boolean equals(Object o)
  {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    HyperLogLog that = (HyperLogLog) o;
    return p == that.p && Arrays.equals(registers, that.registers);
  }

  @Override
  public int hashCode()
  {
    return 31 * p + Arrays.hashCode(registers);
  }

  @Override
  public String toString()
  {
    return "HyperLogLog{" +
           "precision=" + p +
           ", registers=" + m +
           '}';
  }

}
