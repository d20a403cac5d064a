package boxless.email.app.service;

import lombok.Value;

@Value
public class LabelReconcileResult {
    int created;
    int total;
}
