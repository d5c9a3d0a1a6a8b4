// Copyright (c) 2010 Rob Eden.
// All rights reserved.
//
// Redistribution and use in source and binary forms, with or without
// modification, are permitted provided that the following conditions are met:
//     * Redistributions of source code must retain the above copyright
//       notice, this list of conditions and the following disclaimer.
//     * Redistributions in binary form must reproduce the above copyright
//       notice, this list of conditions and the following disclaimer in the
//       documentation and/or other materials provided with the distribution.
//     * Neither the name of Intrepid nor the
//       names of its contributors may be used to endorse or promote products
//       derived from this software without specific prior written permission.
//
// THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS" AND
// ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED
// WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE ARE
// DISCLAIMED. IN NO EVENT SHALL <COPYRIGHT HOLDER> BE LIABLE FOR ANY
// DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES
// (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES;
// LOSS OF USE, DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND
// ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
// (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE OF THIS
// SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.

package com.starlight.conduit.driver.netty;

import com.starlight.conduit.driver.CloseConnectionIndicator;
import com.starlight.conduit.driver.InboundMessageHandler;
import com.starlight.conduit.message.IMessage;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;

import static com.starlight.conduit.driver.netty.NettyConduitDriver.LOCAL_INITIATE_KEY;
import static com.starlight.conduit.driver.netty.NettyConduitDriver.LOCAL_TERMINATE_KEY;


/**
 * Last handler in the pipeline: passes connection events and decoded messages to the
 * {@link InboundMessageHandler}.
 */
class ConnectionHandler extends ChannelInboundHandlerAdapter {
	private static final Logger LOG = LoggerFactory.getLogger( ConnectionHandler.class );

	private final NettyConduitDriver driver;
	private final InboundMessageHandler message_handler;


	ConnectionHandler( @Nonnull NettyConduitDriver driver,
		@Nonnull InboundMessageHandler message_handler ) {

		this.driver = driver;
		this.message_handler = message_handler;
	}


	@Override
	public void exceptionCaught( ChannelHandlerContext context, Throwable cause ) {
		LOG.trace( "exceptionCaught: {}", context, cause );

		// Make sure unexpected errors are printed
		if ( cause instanceof RuntimeException || cause instanceof Error ) {
			LOG.warn( "Unexpected exception caught on {}", context.channel(), cause );
		}
		else LOG.debug( "Exception caught on {}", context.channel(), cause );

		context.channel().attr( LOCAL_TERMINATE_KEY ).set( Boolean.TRUE );
		context.close();
	}


	@Override
	public void channelActive( ChannelHandlerContext context ) throws Exception {
		LOG.trace( "channelActive: {}", context );

		Channel channel = context.channel();
		driver.channelOpened( channel );

		Boolean locally_initiated = channel.attr( LOCAL_INITIATE_KEY ).get();
		message_handler.connectionOpened( ChannelConnection.of( channel, driver ),
			locally_initiated != null && locally_initiated );

		super.channelActive( context );
	}


	@Override
	public void channelInactive( ChannelHandlerContext context ) throws Exception {
		Channel channel = context.channel();
		driver.channelClosed( channel );

		Boolean locally_terminated = channel.attr( LOCAL_TERMINATE_KEY ).get();
		LOG.debug( "Channel closed: {} (local-term={})", channel, locally_terminated );

		try {
			message_handler.connectionClosed( ChannelConnection.of( channel, driver ),
				locally_terminated != null && locally_terminated );
		}
		catch( RuntimeException ex ) {
			LOG.warn( "Error handling close of {}", channel, ex );
		}

		super.channelInactive( context );
	}


	@Override
	public void channelRead( ChannelHandlerContext context, Object message ) {
		LOG.trace( "channelRead: {} - {}", message, context );

		if ( !( message instanceof IMessage ) ) {
			LOG.warn( "Unexpected object in pipeline: {}", message );
			return;
		}

		Channel channel = context.channel();

		final IMessage response;
		try {
			response = message_handler.receivedMessage(
				ChannelConnection.of( channel, driver ), ( IMessage ) message );
		}
		catch( CloseConnectionIndicator close_indicator ) {
			LOG.debug( "Closing {}: {}", channel, close_indicator.getMessage() );
			channel.attr( LOCAL_TERMINATE_KEY ).set( Boolean.TRUE );

			// If there's a message, write it first
			IMessage reason = close_indicator.getReasonMessage();
			if ( reason != null ) {
				context.writeAndFlush( reason ).addListener( ChannelFutureListener.CLOSE );
			}
			else context.close();
			return;
		}
		catch( RuntimeException ex ) {
			LOG.warn( "Error handling {} from {}", message, channel, ex );
			channel.attr( LOCAL_TERMINATE_KEY ).set( Boolean.TRUE );
			context.close();
			return;
		}

		// If there was a response, write it
		if ( response != null ) {
			context.writeAndFlush( response );
		}
	}
}
