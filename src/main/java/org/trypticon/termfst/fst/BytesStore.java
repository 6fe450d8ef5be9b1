/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.trypticon.termfst.fst;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.lucene.store.DataInput;
import org.apache.lucene.store.DataOutput;
import org.apache.lucene.util.Accountable;
import org.apache.lucene.util.RamUsageEstimator;

/**
 * Append-only byte buffer made of fixed size pages, which can be read
 * (forwards or backwards) while it is still being written.
 */
class BytesStore extends DataOutput implements Accountable {

  private static final long BASE_RAM_BYTES_USED =
      RamUsageEstimator.shallowSizeOfInstance(BytesStore.class)
      + RamUsageEstimator.shallowSizeOfInstance(ArrayList.class);

  private final List<byte[]> blocks = new ArrayList<>();

  private final int blockSize;
  private final int blockBits;
  private final int blockMask;

  private byte[] current;
  private int nextWrite;

  BytesStore(int blockBits) {
    this.blockBits = blockBits;
    blockSize = 1 << blockBits;
    blockMask = blockSize - 1;
    nextWrite = blockSize;
  }

  /** Reads {@code numBytes} from {@code in}, using pages no larger than {@code maxBlockSize}. */
  BytesStore(DataInput in, long numBytes, int maxBlockSize) throws IOException {
    int size = 2;
    int bits = 1;
    while (size < numBytes && size < maxBlockSize) {
      size *= 2;
      bits++;
    }
    this.blockBits = bits;
    this.blockSize = size;
    this.blockMask = size - 1;
    long left = numBytes;
    while (left > 0) {
      final int chunk = (int) Math.min(blockSize, left);
      byte[] block = new byte[chunk];
      in.readBytes(block, 0, block.length);
      blocks.add(block);
      left -= chunk;
    }
    // so getPosition() reports the loaded length
    nextWrite = blocks.get(blocks.size() - 1).length;
  }

  int getBlockBits() {
    return blockBits;
  }

  /** Absolute write; {@code dest} must be below the current position. */
  void writeByte(long dest, byte b) {
    byte[] block = blocks.get((int) (dest >> blockBits));
    block[(int) (dest & blockMask)] = b;
  }

  @Override
  public void writeByte(byte b) {
    if (nextWrite == blockSize) {
      current = new byte[blockSize];
      blocks.add(current);
      nextWrite = 0;
    }
    current[nextWrite++] = b;
  }

  @Override
  public void writeBytes(byte[] b, int offset, int len) {
    while (len > 0) {
      int chunk = blockSize - nextWrite;
      if (len <= chunk) {
        System.arraycopy(b, offset, current, nextWrite, len);
        nextWrite += len;
        break;
      }
      if (chunk > 0) {
        System.arraycopy(b, offset, current, nextWrite, chunk);
        offset += chunk;
        len -= chunk;
      }
      current = new byte[blockSize];
      blocks.add(current);
      nextWrite = 0;
    }
  }

  /**
   * Absolute write over already written bytes, leaving the position alone.
   * Copies from the end backwards so overlapping self copies stay intact.
   */
  void writeBytes(long dest, byte[] b, int offset, int len) {
    assert dest + len <= getPosition() : "dest=" + dest + " pos=" + getPosition() + " len=" + len;

    final long end = dest + len;
    int blockIndex = (int) (end >> blockBits);
    int downTo = (int) (end & blockMask);
    if (downTo == 0) {
      blockIndex--;
      downTo = blockSize;
    }
    byte[] block = blocks.get(blockIndex);

    while (len > 0) {
      if (len <= downTo) {
        System.arraycopy(b, offset, block, downTo - len, len);
        break;
      }
      len -= downTo;
      System.arraycopy(b, offset + len, block, 0, downTo);
      blockIndex--;
      block = blocks.get(blockIndex);
      downTo = blockSize;
    }
  }

  /** Copies {@code len} bytes from {@code src} to a later {@code dest} within this store. */
  void copyBytes(long src, long dest, int len) {
    assert src < dest;

    long end = src + len;
    int blockIndex = (int) (end >> blockBits);
    int downTo = (int) (end & blockMask);
    if (downTo == 0) {
      blockIndex--;
      downTo = blockSize;
    }
    byte[] block = blocks.get(blockIndex);

    while (len > 0) {
      if (len <= downTo) {
        writeBytes(dest, block, downTo - len, len);
        break;
      }
      len -= downTo;
      writeBytes(dest + len, block, 0, downTo);
      blockIndex--;
      block = blocks.get(blockIndex);
      downTo = blockSize;
    }
  }

  /** Copies bytes out of this store into {@code dest}. */
  void copyBytes(long src, byte[] dest, int offset, int len) {
    int blockIndex = (int) (src >> blockBits);
    int upto = (int) (src & blockMask);
    byte[] block = blocks.get(blockIndex);
    while (len > 0) {
      int chunk = blockSize - upto;
      if (len <= chunk) {
        System.arraycopy(block, upto, dest, offset, len);
        break;
      }
      System.arraycopy(block, upto, dest, offset, chunk);
      blockIndex++;
      block = blocks.get(blockIndex);
      upto = 0;
      len -= chunk;
      offset += chunk;
    }
  }

  /** Reverses the bytes from {@code srcPos} to {@code destPos}, both inclusive. */
  void reverse(long srcPos, long destPos) {
    assert srcPos < destPos;
    assert destPos < getPosition();

    int srcBlockIndex = (int) (srcPos >> blockBits);
    int src = (int) (srcPos & blockMask);
    byte[] srcBlock = blocks.get(srcBlockIndex);

    int destBlockIndex = (int) (destPos >> blockBits);
    int dest = (int) (destPos & blockMask);
    byte[] destBlock = blocks.get(destBlockIndex);

    int limit = (int) (destPos - srcPos + 1) / 2;
    for (int i = 0; i < limit; i++) {
      byte b = srcBlock[src];
      srcBlock[src] = destBlock[dest];
      destBlock[dest] = b;

      src++;
      if (src == blockSize) {
        srcBlockIndex++;
        srcBlock = blocks.get(srcBlockIndex);
        src = 0;
      }

      dest--;
      if (dest == -1) {
        destBlockIndex--;
        destBlock = blocks.get(destBlockIndex);
        dest = blockSize - 1;
      }
    }
  }

  /** Grows the store by {@code len} bytes without writing them. */
  void skipBytes(int len) {
    while (len > 0) {
      int chunk = blockSize - nextWrite;
      if (len <= chunk) {
        nextWrite += len;
        break;
      }
      len -= chunk;
      current = new byte[blockSize];
      blocks.add(current);
      nextWrite = 0;
    }
  }

  long getPosition() {
    return ((long) blocks.size() - 1) * blockSize + nextWrite;
  }

  /** Drops everything at and after {@code newLen}; it cannot grow the store. */
  void truncate(long newLen) {
    assert newLen <= getPosition();
    assert newLen >= 0;
    int blockIndex = (int) (newLen >> blockBits);
    nextWrite = (int) (newLen & blockMask);
    if (nextWrite == 0) {
      blockIndex--;
      nextWrite = blockSize;
    }
    blocks.subList(blockIndex + 1, blocks.size()).clear();
    if (newLen == 0) {
      current = null;
    } else {
      current = blocks.get(blockIndex);
    }
    assert newLen == getPosition();
  }

  /** Trims the last page to its used length. No writes are allowed afterwards. */
  void finish() {
    if (current != null) {
      byte[] lastBuffer = new byte[nextWrite];
      System.arraycopy(current, 0, lastBuffer, 0, nextWrite);
      blocks.set(blocks.size() - 1, lastBuffer);
      current = null;
    }
  }

  void writeTo(DataOutput out) throws IOException {
    for (byte[] block : blocks) {
      out.writeBytes(block, 0, block.length);
    }
  }

  FST.BytesReader getForwardReader() {
    if (blocks.size() == 1) {
      return new ForwardBytesReader(blocks.get(0));
    }
    return new FST.BytesReader() {
      private byte[] current;
      private int nextBuffer;
      private int nextRead = blockSize;

      @Override
      public byte readByte() {
        if (nextRead == blockSize) {
          current = blocks.get(nextBuffer++);
          nextRead = 0;
        }
        return current[nextRead++];
      }

      @Override
      public void skipBytes(long count) {
        setPosition(getPosition() + count);
      }

      @Override
      public void readBytes(byte[] b, int offset, int len) {
        while (len > 0) {
          int chunkLeft = blockSize - nextRead;
          if (len <= chunkLeft) {
            System.arraycopy(current, nextRead, b, offset, len);
            nextRead += len;
            break;
          }
          if (chunkLeft > 0) {
            System.arraycopy(current, nextRead, b, offset, chunkLeft);
            offset += chunkLeft;
            len -= chunkLeft;
          }
          current = blocks.get(nextBuffer++);
          nextRead = 0;
        }
      }

      @Override
      public long getPosition() {
        return ((long) nextBuffer - 1) * blockSize + nextRead;
      }

      @Override
      public void setPosition(long pos) {
        int bufferIndex = (int) (pos >> blockBits);
        nextBuffer = bufferIndex + 1;
        current = blocks.get(bufferIndex);
        nextRead = (int) (pos & blockMask);
        assert getPosition() == pos;
      }

      @Override
      public boolean reversed() {
        return false;
      }
    };
  }

  FST.BytesReader getReverseReader() {
    return getReverseReader(true);
  }

  /**
   * @param allowSingle whether a single page store may use the array reader;
   *                    must be false while the store is still growing.
   */
  FST.BytesReader getReverseReader(boolean allowSingle) {
    if (allowSingle && blocks.size() == 1) {
      return new ReverseBytesReader(blocks.get(0));
    }
    return new FST.BytesReader() {
      private byte[] current = blocks.size() == 0 ? null : blocks.get(0);
      private int nextBuffer = -1;
      private int nextRead = 0;

      @Override
      public byte readByte() {
        if (nextRead == -1) {
          current = blocks.get(nextBuffer--);
          nextRead = blockSize - 1;
        }
        return current[nextRead--];
      }

      @Override
      public void skipBytes(long count) {
        setPosition(getPosition() - count);
      }

      @Override
      public void readBytes(byte[] b, int offset, int len) {
        for (int i = 0; i < len; i++) {
          b[offset + i] = readByte();
        }
      }

      @Override
      public long getPosition() {
        return ((long) nextBuffer + 1) * blockSize + nextRead;
      }

      @Override
      public void setPosition(long pos) {
        int bufferIndex = (int) (pos >> blockBits);
        nextBuffer = bufferIndex - 1;
        current = blocks.get(bufferIndex);
        nextRead = (int) (pos & blockMask);
        assert getPosition() == pos : "pos=" + pos + " getPos()=" + getPosition();
      }

      @Override
      public boolean reversed() {
        return true;
      }
    };
  }

  @Override
  public long ramBytesUsed() {
    long size = BASE_RAM_BYTES_USED;
    for (byte[] block : blocks) {
      size += RamUsageEstimator.sizeOf(block);
    }
    return size;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(numBlocks=" + blocks.size() + ")";
  }
}
