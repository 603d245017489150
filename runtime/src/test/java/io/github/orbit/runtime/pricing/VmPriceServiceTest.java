package io.github.orbit.runtime.pricing;

import io.github.orbit.protocol.api.ProviderType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class VmPriceServiceTest {

    @Test
    void routesToClientForProviderType() throws Exception {
        PricingClient digitalOcean = mock(PricingClient.class);
        when(digitalOcean.providerType()).thenReturn(ProviderType.DIGITALOCEAN);
        ProviderSettings settings = settings(ProviderType.DIGITALOCEAN);
        when(digitalOcean.hourlyPrice(settings, "s-1vcpu-1gb")).thenReturn(OptionalDouble.of(0.00893));

        VmPriceService service = new VmPriceService(List.of(digitalOcean));

        assertThat(service.hourlyPrice(settings, "s-1vcpu-1gb")).hasValue(0.00893);
    }

    @Test
    void unsupportedProviderTypeFails() {
        PricingClient digitalOcean = mock(PricingClient.class);
        when(digitalOcean.providerType()).thenReturn(ProviderType.DIGITALOCEAN);
        VmPriceService service = new VmPriceService(List.of(digitalOcean));

        assertThatThrownBy(() -> service.hourlyPrice(settings(ProviderType.AWS), "t3.micro"))
                .isInstanceOf(PricingLookupException.class)
                .hasMessageContaining("AWS");
    }

    private static ProviderSettings settings(ProviderType type) {
        return new ProviderSettings("p1", type, "nyc3", null);
    }
}
