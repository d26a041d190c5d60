package org.pragmatica.dnsb.compiler.plan;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FilePlacementTest {

    @Test
    void fromVolume_keepsResourcePrefixInSource() {
        FilePlacement.fromVolume("svc", "resource:templates/configs/bind/named.recursor.conf:/etc/bind/named.conf")
                     .onFailure(cause -> Assertions.fail(cause.message()))
                     .onSuccess(placement -> {
                         assertThat(placement).isInstanceOf(FilePlacement.Copied.class);
                         var copied = (FilePlacement.Copied) placement;
                         assertThat(copied.source()).isEqualTo("resource:templates/configs/bind/named.recursor.conf");
                         assertThat(copied.containerPath()).isEqualTo("/etc/bind/named.conf");
                         assertThat(copied.fileName()).isEqualTo("named.conf");
                     });
    }

    @Test
    void fromVolume_mountsOriginPathsAsGiven() {
        FilePlacement.fromVolume("svc", "${origin}/var/log/dns:/var/log/named")
                     .onFailure(cause -> Assertions.fail(cause.message()))
                     .onSuccess(placement -> assertThat(placement).isEqualTo(new FilePlacement.Mounted("/var/log/dns", "/var/log/named")));
    }

    @Test
    void fromVolume_rejectsEntryWithoutContainerPath() {
        FilePlacement.fromVolume("svc", "named.conf")
                     .onSuccessRun(Assertions::fail)
                     .onFailure(cause -> assertThat(cause).isInstanceOf(PlanError.InvalidVolume.class));
        FilePlacement.fromVolume("svc", "named.conf:")
                     .onSuccessRun(Assertions::fail)
                     .onFailure(cause -> assertThat(cause).isInstanceOf(PlanError.InvalidVolume.class));
    }
}
