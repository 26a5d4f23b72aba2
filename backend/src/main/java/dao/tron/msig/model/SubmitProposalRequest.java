package dao.tron.msig.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

@Data
public class SubmitProposalRequest {

    @NotBlank
    private String to;

    @NotBlank
    @Pattern(regexp = "\\d+")
    private String amount;          // string decimal, token smallest unit
}
