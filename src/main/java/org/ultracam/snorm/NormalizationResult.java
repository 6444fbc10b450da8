package org.ultracam.snorm;

import org.ultracam.snorm.fit.RobustFit;

/**
 * Everything produced by normalizing one frame.
 *
 * @author ultracam
 */
public class NormalizationResult {

    private final Profile profile;
    private final RobustFit fit;
    private final ExtrapolatedCurve curve;
    private final Frame frame;

    NormalizationResult(Profile profile, RobustFit fit, ExtrapolatedCurve curve, Frame frame) {
        this.profile = profile;
        this.fit = fit;
        this.curve = curve;
        this.frame = frame;
    }

    public Profile getProfile() {
        return profile;
    }

    /**
     * @return The robust fit, whose samples are those of the profile lying in
     * the fit domain, in profile order
     */
    public RobustFit getFit() {
        return fit;
    }

    public ExtrapolatedCurve getCurve() {
        return curve;
    }

    /**
     * @return The normalized frame
     */
    public Frame getFrame() {
        return frame;
    }

    @Override
    public String toString() {
        return "NormalizationResult{" + "profile=" + profile + ", fit=" + fit + '}';
    }
}
