package com.redhat.cdsync.cli;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import com.redhat.cdsync.engine.error.ConflictException;
import com.redhat.cdsync.engine.error.NotFoundException;
import com.redhat.cdsync.engine.error.TransientIOException;
import com.redhat.cdsync.resources.model.v1alpha1.ImageOverride;

public class CreateApplicationCommandTest {

    @Test
    public void testImageOverride() {
        assertThat(CreateApplicationCommand.imageOverride("quay.io/acme/web"))
                .isEqualTo(new ImageOverride("quay.io/acme/web", null, null, null));
        assertThat(CreateApplicationCommand.imageOverride("web=quay.io/acme/web"))
                .isEqualTo(new ImageOverride("web", "quay.io/acme/web", null, null));
    }

    @Test
    public void testExitCodes() {
        assertThat(ExitCodes.forError(new NotFoundException("gone"))).isEqualTo(ExitCodes.USER_ERROR);
        assertThat(ExitCodes.forError(new ConflictException("taken"))).isEqualTo(ExitCodes.USER_ERROR);
        assertThat(ExitCodes.forError(new TransientIOException("timeout"))).isEqualTo(ExitCodes.SYNC_FAILURE);
    }
}
