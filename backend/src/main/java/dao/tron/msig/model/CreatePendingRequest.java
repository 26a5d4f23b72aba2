package dao.tron.msig.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

@Data
public class CreatePendingRequest {

    @NotBlank
    private String to;

    @NotBlank
    @Pattern(regexp = "\\d+")
    private String amount;          // smallest unit: SUN for TRX, token decimals otherwise

    /** "TRX" or a TRC20 contract address; defaults to TRX */
    private String asset;

    private String description;
}
