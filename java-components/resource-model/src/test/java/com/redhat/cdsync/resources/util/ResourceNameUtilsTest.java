package com.redhat.cdsync.resources.util;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ResourceNameUtilsTest {

    @Test
    void validNames() {
        Assertions.assertTrue(ResourceNameUtils.isValidName("demo-app"));
        Assertions.assertTrue(ResourceNameUtils.isValidName("demo.app.v1"));
        Assertions.assertFalse(ResourceNameUtils.isValidName("Demo"));
        Assertions.assertFalse(ResourceNameUtils.isValidName("-demo"));
        Assertions.assertFalse(ResourceNameUtils.isValidName(""));
        Assertions.assertFalse(ResourceNameUtils.isValidName(null));
        Assertions.assertTrue(ResourceNameUtils.isValidNamespace("team-a"));
        Assertions.assertFalse(ResourceNameUtils.isValidNamespace("team.a"));
    }

    @Test
    void hashes() {
        Assertions.assertEquals("a94a8fe5ccb19ba61c4c0873d391e987982fbbd3", HashUtil.sha1("test"));
        Assertions.assertEquals(HashUtil.sha1("test"), HashUtil.toHex(HashUtil.sha1Digest().digest("test".getBytes())));
    }
}
