package io.imagexform.magick;

import java.util.Set;

/**
 * ImageMagick command-line options the engine forwards, in underscore form. These names are the
 * engine's pass-through primitives and its accepted loader and saver options; anything else is
 * rejected at resolution time or dropped from the option maps.
 */
final class MagickOptions {

    static final Set<String> NAMES = Set.of(
            "adaptive_blur", "adaptive_resize", "adaptive_sharpen", "alpha", "annotate", "antialias",
            "attenuate", "auto_gamma", "auto_level", "auto_orient", "auto_threshold", "background", "bench",
            "bias", "black_point_compensation", "black_threshold", "blend", "blue_primary", "blue_shift",
            "blur", "border", "bordercolor", "brightness_contrast", "canny", "caption", "cdl", "channel",
            "charcoal", "chop", "clahe", "clamp", "clip", "clip_mask", "clip_path", "clut", "coalesce",
            "color_matrix", "colorize", "colors", "colorspace", "combine", "comment", "compose", "composite",
            "compress", "connected_components", "contrast", "contrast_stretch", "convolve", "crop", "cycle",
            "deconstruct", "define", "delay", "density", "depth", "descend", "deskew", "despeckle",
            "direction", "dispose", "distort", "dither", "draw", "edge", "emboss", "encoding", "endian",
            "enhance", "equalize", "evaluate", "extent", "extract", "family", "features", "fill", "filter",
            "flatten", "flip", "flood_fill", "flop", "font", "format", "frame", "fuzz", "fx", "gamma",
            "gaussian_blur", "geometry", "gravity", "grayscale", "green_primary", "hald_clut", "identify",
            "implode", "intensity", "intent", "interlace", "interline_spacing", "interpolate",
            "interword_spacing", "kerning", "kuwahara", "label", "lat", "layers", "level", "level_colors",
            "limit", "linear_stretch", "liquid_rescale", "list", "log", "loop", "mattecolor", "mean_shift",
            "median", "metric", "mode", "modulate", "moments", "monitor", "monochrome", "morph",
            "morphology", "motion_blur", "negate", "noise", "normalize", "opaque", "ordered_dither",
            "orient", "page", "paint", "perceptible", "ping", "pointsize", "polaroid", "posterize",
            "precision", "preview", "print", "process", "profile", "quality", "quantize", "quiet",
            "radial_blur", "raise", "random_threshold", "range_threshold", "red_primary", "regard_warnings",
            "region", "remap", "render", "repage", "resample", "resize", "respect_parentheses", "roll",
            "rotate", "sample", "sampling_factor", "scale", "scene", "seed", "segment", "selective_blur",
            "separate", "sepia_tone", "set", "shade", "shadow", "sharpen", "shave", "shear",
            "sigmoidal_contrast", "size", "sketch", "smush", "solarize", "sparse_color", "splice", "spread",
            "statistic", "stretch", "strip", "stroke", "strokewidth", "style", "swap", "swirl",
            "synchronize", "taint", "texture", "threshold", "thumbnail", "tile", "tile_offset", "tint",
            "transform", "transparent", "transparent_color", "transpose", "transverse", "treedepth", "trim",
            "type", "undercolor", "unique_colors", "units", "unsharp", "verbose", "view", "vignette",
            "virtual_pixel", "wave", "wavelet_denoise", "weight", "white_point", "white_threshold", "write");

    private MagickOptions() {
        // utility class
    }
}
