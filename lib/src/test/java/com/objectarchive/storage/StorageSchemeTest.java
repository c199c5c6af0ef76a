package com.objectarchive.storage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class StorageSchemeTest {

  @Test
  void testClassify() {
    assertEquals(StorageScheme.S3, StorageScheme.classify("s3://bucket/key"));
    assertEquals(StorageScheme.HDFS, StorageScheme.classify("hdfs://namenode:8020/data"));
    assertEquals(StorageScheme.LOCAL, StorageScheme.classify("/data/archive"));
    assertEquals(StorageScheme.LOCAL, StorageScheme.classify("file:///data/archive"));
    assertEquals(StorageScheme.LOCAL, StorageScheme.classify("relative/s3://not-a-scheme"));
  }

  @Test
  void testRemote() {
    assertFalse(StorageScheme.LOCAL.isRemote());
    assertTrue(StorageScheme.S3.isRemote());
    assertTrue(StorageScheme.HDFS.isRemote());
  }
}
