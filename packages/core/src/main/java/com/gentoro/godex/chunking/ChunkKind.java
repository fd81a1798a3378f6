package com.gentoro.godex.chunking;

public enum ChunkKind {
  FUNCTION,
  TYPE
}
