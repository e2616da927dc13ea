package org.apache.credctl.auth;

import static org.apache.credctl.auth.ScriptedCredentialGenerator.accessKey;
import static org.apache.credctl.auth.ScriptedCredentialGenerator.secretKey;

import org.junit.Assert;
import org.junit.Test;

public class UserCredentialsTest {

    @Test
    public void testToStringHidesSecret() {
        UserCredentials credentials = new UserCredentials("alice", accessKey('A'), secretKey('s'));
        Assert.assertTrue(credentials.toString().contains(accessKey('A')));
        Assert.assertFalse(credentials.toString().contains(secretKey('s')));
    }

    @Test
    public void testEquality() {
        UserCredentials credentials = new UserCredentials("alice", accessKey('A'), secretKey('s'));
        Assert.assertEquals(credentials,
                new UserCredentials("alice", accessKey('A'), secretKey('s')));
        Assert.assertEquals(credentials.hashCode(),
                new UserCredentials("alice", accessKey('A'), secretKey('s')).hashCode());
        Assert.assertNotEquals(credentials,
                new UserCredentials("bob", accessKey('A'), secretKey('s')));
        Assert.assertNotEquals(credentials,
                new UserCredentials("alice", accessKey('B'), secretKey('s')));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testShortAccessKeyRejected() {
        new UserCredentials("alice", "AKIA", secretKey('s'));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testLongSecretRejected() {
        new UserCredentials("alice", accessKey('A'), secretKey('s') + "x");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyUserRejected() {
        new UserCredentials("", accessKey('A'), secretKey('s'));
    }
}
