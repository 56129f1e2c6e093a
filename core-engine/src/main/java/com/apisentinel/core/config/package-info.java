/**
 * YAML-driven engine configuration: the {@link com.apisentinel.core.config.EngineConfig}
 * bean tree, its loader and the hot-reloadable
 * {@link com.apisentinel.core.config.ConfigHolder}.
 *
 * @since 1.0.0
 */
package com.apisentinel.core.config;
