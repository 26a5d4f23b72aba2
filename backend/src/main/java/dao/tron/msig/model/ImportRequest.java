package dao.tron.msig.model;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ImportRequest {

    /** Blob produced by an export on another custodian's instance. */
    @NotBlank
    private String blob;
}
